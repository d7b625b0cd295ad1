package com.hwbscan.pattern;

import com.hwbscan.config.PatternParameters;
import com.hwbscan.indicator.IndicatorEngine;
import com.hwbscan.model.BreakoutOutcome;
import com.hwbscan.model.Gap;
import com.hwbscan.model.PriceBar;
import com.hwbscan.model.PriceSeries;
import com.hwbscan.model.Setup;

import java.util.Arrays;

/**
 * Walks bars after a gap and reports the first violation or qualifying breakout.
 * On every bar the violation test runs before the breakout test.
 */
public final class BreakoutFinder {
    static final int VOLUME_AVERAGE_BARS = 20;

    private final PatternParameters params;
    private final IndicatorEngine indicators;

    public BreakoutFinder(PatternParameters params, IndicatorEngine indicators) {
        this.params = params;
        this.indicators = indicators;
    }

    public BreakoutOutcome evaluate(PriceSeries daily, Setup setup, Gap gap) {
        return evaluate(daily, setup, gap, 0);
    }

    /**
     * @param scanFromIndex first bar eligible for evaluation; bars before it were
     *                      already judged by an earlier run
     * @throws com.hwbscan.model.SeriesLookupException when the setup or gap date is not in the series
     */
    public BreakoutOutcome evaluate(PriceSeries daily, Setup setup, Gap gap, int scanFromIndex) {
        int setupIdx = daily.requireIndex(setup.date);
        int gapIdx = daily.requireIndex(gap.formationDate);
        double resistance = resistance(daily, setupIdx, gapIdx);
        double floor = gap.lowerBound * (1.0 - params.violationTolerance);

        for (int i = Math.max(gapIdx + 1, scanFromIndex); i <= daily.lastIndex(); i++) {
            PriceBar bar = daily.get(i);
            if (bar.low < floor) {
                return BreakoutOutcome.violated(bar.date, resistance);
            }
            double vol = indicators.returnVolatility(daily, i - 1, params.volatilityWindow);
            double threshold = Math.max(params.breakoutBaseThreshold, Math.min(params.breakoutThresholdCap, vol * 3.0));
            boolean priceOk = bar.close > resistance * (1.0 + threshold);
            if (!priceOk) {
                continue;
            }
            int score = 3;
            double avgVolume = indicators.averageVolume(daily, i, VOLUME_AVERAGE_BARS);
            if (avgVolume > 0 && bar.volume > params.volumeConfirmRatio * avgVolume) {
                score += 2;
            }
            if (indicators.momentum(daily, i, params.momentumBars) > 0) {
                score += 1;
            }
            if (score >= params.breakoutMinScore) {
                return BreakoutOutcome.breakout(bar.date, bar.close, resistance, score);
            }
        }
        return BreakoutOutcome.none();
    }

    /**
     * Median of max high, max close, VWAP and classic pivot over the look-back
     * window ending at the gap bar, never reaching before the setup bar.
     */
    double resistance(PriceSeries daily, int setupIdx, int gapIdx) {
        int from = Math.max(setupIdx, gapIdx - params.resistanceLookback + 1);
        double maxHigh = Double.NEGATIVE_INFINITY;
        double maxClose = Double.NEGATIVE_INFINITY;
        double minLow = Double.POSITIVE_INFINITY;
        double pv = 0.0;
        double volume = 0.0;
        double typicalSum = 0.0;
        for (int i = from; i <= gapIdx; i++) {
            PriceBar bar = daily.get(i);
            maxHigh = Math.max(maxHigh, bar.high);
            maxClose = Math.max(maxClose, bar.close);
            minLow = Math.min(minLow, bar.low);
            double typical = (bar.high + bar.low + bar.close) / 3.0;
            pv += typical * bar.volume;
            volume += bar.volume;
            typicalSum += typical;
        }
        int n = gapIdx - from + 1;
        double vwap = volume > 0 ? pv / volume : typicalSum / n;
        double pivot = (maxHigh + minLow + daily.get(gapIdx).close) / 3.0;
        double[] levels = {maxHigh, maxClose, vwap, pivot};
        Arrays.sort(levels);
        return (levels[1] + levels[2]) / 2.0;
    }
}
