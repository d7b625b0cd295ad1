package com.hwbscan.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Objects;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Signal {
    public final String id;
    public final String setupId;
    public final String fvgId;
    public final LocalDate breakoutDate;
    public final double breakoutPrice;
    public final double resistancePrice;
    public final int score;
    public final QualityTier confidence;
    public final double breakoutPercentage;

    /**
     * Builds the terminal signal for a gap that broke out under its owning setup.
     */
    public static Signal fromBreakout(Setup setup, Gap gap, BreakoutOutcome breakout) {
        Objects.requireNonNull(setup, "setup");
        Objects.requireNonNull(gap, "gap");
        Objects.requireNonNull(breakout, "breakout");
        if (!breakout.isBreakout()) {
            throw new IllegalArgumentException("not a breakout: " + breakout);
        }
        if (!setup.id.equals(gap.setupId)) {
            throw new IllegalArgumentException("gap " + gap.id + " does not belong to " + setup.id);
        }
        return new Signal(
                EntityIds.signalId(breakout.date, setup.date),
                setup.id,
                gap.id,
                breakout.date,
                breakout.price,
                breakout.resistance,
                breakout.score,
                QualityTier.forBreakoutScore(breakout.score),
                breakout.breakoutPercentage()
        );
    }
}
