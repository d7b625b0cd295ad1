package com.hwbscan.indicator;

import com.hwbscan.config.PatternParameters;
import com.hwbscan.model.PriceBar;
import com.hwbscan.model.PriceSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：IndicatorEngine（class）。
 * 主要职责：计算 200 周期均线、ATR、成交量均值与收益波动率。
 * 使用建议：均线必须在完整序列上重算，不能只算增量部分。
 */
public final class IndicatorEngine {
    private final int maPeriod;
    private final int minPeriods;

    public IndicatorEngine() {
        this(200, 50);
    }

    public IndicatorEngine(PatternParameters params) {
        this(params.maPeriod, params.maMinPeriods);
    }

    public IndicatorEngine(int maPeriod, int minPeriods) {
        this.maPeriod = Math.max(1, maPeriod);
        this.minPeriods = Math.max(1, Math.min(minPeriods, this.maPeriod));
    }

    /**
     * Recomputes SMA and EMA of close over the entire daily series.
     */
    public PriceSeries withDailyAverages(PriceSeries series) {
        if (series == null || series.isEmpty()) {
            return PriceSeries.empty();
        }
        double[] closes = closes(series);
        Double[] sma = rollingSma(closes);
        Double[] ema = ewm(closes);
        List<PriceBar> out = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            out.add(series.get(i).withAverages(sma[i], ema[i]));
        }
        return PriceSeries.of(out);
    }

    /**
     * Weekly bars carry the simple average only.
     */
    public PriceSeries withWeeklyAverages(PriceSeries series) {
        if (series == null || series.isEmpty()) {
            return PriceSeries.empty();
        }
        Double[] sma = rollingSma(closes(series));
        List<PriceBar> out = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            out.add(series.get(i).withAverages(sma[i], null));
        }
        return PriceSeries.of(out);
    }

    /**
     * Average true range over the {@code period} bars ending at {@code index}; 0 when
     * fewer than two bars exist.
     */
    public double atr(PriceSeries series, int index, int period) {
        if (series == null || index <= 0 || index >= series.size() || period <= 0) {
            return 0.0;
        }
        int start = Math.max(1, index - period + 1);
        double sum = 0.0;
        int n = 0;
        for (int i = start; i <= index; i++) {
            PriceBar bar = series.get(i);
            double prevClose = series.get(i - 1).close;
            double tr1 = bar.high - bar.low;
            double tr2 = Math.abs(bar.high - prevClose);
            double tr3 = Math.abs(bar.low - prevClose);
            sum += Math.max(tr1, Math.max(tr2, tr3));
            n++;
        }
        return n == 0 ? 0.0 : sum / n;
    }

    /**
     * Mean volume of the {@code period} bars preceding {@code index}; 0 when there are none.
     */
    public double averageVolume(PriceSeries series, int index, int period) {
        if (series == null || index <= 0 || period <= 0) {
            return 0.0;
        }
        int end = Math.min(index, series.size());
        int start = Math.max(0, end - period);
        if (start >= end) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = start; i < end; i++) {
            sum += series.get(i).volume;
        }
        return sum / (end - start);
    }

    /**
     * Standard deviation of simple daily returns over {@code window} returns ending
     * at {@code index}, as a fraction.
     */
    public double returnVolatility(PriceSeries series, int index, int window) {
        if (series == null || index <= 0 || window <= 0) {
            return 0.0;
        }
        int end = Math.min(index, series.size() - 1);
        int start = Math.max(1, end - window + 1);
        int count = end - start + 1;
        if (count < 2) {
            return 0.0;
        }
        double[] returns = new double[count];
        for (int i = start; i <= end; i++) {
            double prev = series.get(i - 1).close;
            double next = series.get(i).close;
            returns[i - start] = prev <= 0 ? 0.0 : (next - prev) / prev;
        }
        double mean = 0.0;
        for (double r : returns) {
            mean += r;
        }
        mean /= count;
        double var = 0.0;
        for (double r : returns) {
            double d = r - mean;
            var += d * d;
        }
        var /= (count - 1);
        return Math.sqrt(var);
    }

    /**
     * Close change over {@code bars} bars ending at {@code index}; 0 without enough history.
     */
    public double momentum(PriceSeries series, int index, int bars) {
        if (series == null || index < bars || index >= series.size() || bars <= 0) {
            return 0.0;
        }
        return series.get(index).close - series.get(index - bars).close;
    }

    private Double[] rollingSma(double[] values) {
        Double[] out = new Double[values.length];
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= maPeriod) {
                sum -= values[i - maPeriod];
            }
            int count = Math.min(i + 1, maPeriod);
            out[i] = count >= minPeriods ? sum / count : null;
        }
        return out;
    }

    private Double[] ewm(double[] values) {
        Double[] out = new Double[values.length];
        double alpha = 2.0 / (maPeriod + 1.0);
        double ema = 0.0;
        for (int i = 0; i < values.length; i++) {
            ema = i == 0 ? values[0] : alpha * values[i] + (1.0 - alpha) * ema;
            out[i] = i + 1 >= minPeriods ? ema : null;
        }
        return out;
    }

    private double[] closes(PriceSeries series) {
        double[] closes = new double[series.size()];
        for (int i = 0; i < series.size(); i++) {
            closes[i] = series.get(i).close;
        }
        return closes;
    }
}
