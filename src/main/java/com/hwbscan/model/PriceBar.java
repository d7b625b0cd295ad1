package com.hwbscan.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * 模块说明：PriceBar（class）。
 * 主要职责：一根日线或周线K线，附带 200 周期均线；历史不足时均线为 null。
 */
public final class PriceBar {
    public final LocalDate date;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final long volume;
    public final Double sma200;
    public final Double ema200;

    public PriceBar(LocalDate date, double open, double high, double low, double close, long volume) {
        this(date, open, high, low, close, volume, null, null);
    }

    public PriceBar(
            LocalDate date,
            double open,
            double high,
            double low,
            double close,
            long volume,
            Double sma200,
            Double ema200
    ) {
        this.date = Objects.requireNonNull(date, "date");
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = Math.max(0L, volume);
        this.sma200 = sma200;
        this.ema200 = ema200;
    }

    public PriceBar withAverages(Double sma, Double ema) {
        return new PriceBar(date, open, high, low, close, volume, sma, ema);
    }

    public boolean hasAverages() {
        return sma200 != null && ema200 != null;
    }

    public double bodyMidpoint() {
        return (open + close) / 2.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PriceBar)) {
            return false;
        }
        PriceBar other = (PriceBar) o;
        return Double.compare(open, other.open) == 0
                && Double.compare(high, other.high) == 0
                && Double.compare(low, other.low) == 0
                && Double.compare(close, other.close) == 0
                && volume == other.volume
                && date.equals(other.date)
                && Objects.equals(sma200, other.sma200)
                && Objects.equals(ema200, other.ema200);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, open, high, low, close, volume, sma200, ema200);
    }

    @Override
    public String toString() {
        return "PriceBar{" + date + " o=" + open + " h=" + high + " l=" + low + " c=" + close + " v=" + volume + "}";
    }
}
