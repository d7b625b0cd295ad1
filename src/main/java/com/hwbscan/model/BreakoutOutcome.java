package com.hwbscan.model;

import java.time.LocalDate;

/**
 * Result of evaluating one gap for breakout: a breakout, a violation, or nothing yet.
 */
public final class BreakoutOutcome {
    public enum Kind {
        BREAKOUT,
        VIOLATED,
        NONE
    }

    private static final BreakoutOutcome NONE = new BreakoutOutcome(Kind.NONE, null, 0.0, 0.0, 0);

    public final Kind kind;
    public final LocalDate date;
    public final double price;
    public final double resistance;
    public final int score;

    private BreakoutOutcome(Kind kind, LocalDate date, double price, double resistance, int score) {
        this.kind = kind;
        this.date = date;
        this.price = price;
        this.resistance = resistance;
        this.score = score;
    }

    public static BreakoutOutcome breakout(LocalDate date, double price, double resistance, int score) {
        return new BreakoutOutcome(Kind.BREAKOUT, date, price, resistance, score);
    }

    public static BreakoutOutcome violated(LocalDate date, double resistance) {
        return new BreakoutOutcome(Kind.VIOLATED, date, 0.0, resistance, 0);
    }

    public static BreakoutOutcome none() {
        return NONE;
    }

    public boolean isBreakout() {
        return kind == Kind.BREAKOUT;
    }

    public boolean isViolated() {
        return kind == Kind.VIOLATED;
    }

    public double breakoutPercentage() {
        if (kind != Kind.BREAKOUT || resistance <= 0) {
            return 0.0;
        }
        return (price / resistance - 1.0) * 100.0;
    }

    @Override
    public String toString() {
        return "BreakoutOutcome{" + kind + (date == null ? "" : " " + date) + "}";
    }
}
