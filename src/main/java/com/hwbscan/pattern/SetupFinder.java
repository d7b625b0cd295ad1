package com.hwbscan.pattern;

import com.hwbscan.config.PatternParameters;
import com.hwbscan.indicator.IndicatorEngine;
import com.hwbscan.model.EntityIds;
import com.hwbscan.model.PriceBar;
import com.hwbscan.model.PriceSeries;
import com.hwbscan.model.Setup;
import com.hwbscan.model.SetupKind;
import com.hwbscan.model.SetupStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds days whose candle body sits inside the zone spanned by the daily SMA200
 * and EMA200, widened by a volatility margin.
 */
public final class SetupFinder {
    static final int ATR_PERIOD = 14;

    private final PatternParameters params;
    private final IndicatorEngine indicators;
    private final TrendFilter trendFilter;

    public SetupFinder(PatternParameters params, IndicatorEngine indicators, TrendFilter trendFilter) {
        this.params = params;
        this.indicators = indicators;
        this.trendFilter = trendFilter;
    }

    /**
     * Scans daily indices {@code fromIndex..toIndex} inclusive.
     */
    public List<Setup> find(PriceSeries daily, PriceSeries weekly, int fromIndex, int toIndex) {
        List<Setup> out = new ArrayList<>();
        if (daily == null || daily.isEmpty()) {
            return out;
        }
        int from = Math.max(0, fromIndex);
        int to = Math.min(daily.lastIndex(), toIndex);
        for (int i = from; i <= to; i++) {
            PriceBar bar = daily.get(i);
            if (!bar.hasAverages()) {
                continue;
            }
            double sma = bar.sma200;
            double ema = bar.ema200;
            double atr = indicators.atr(daily, i, ATR_PERIOD);
            double margin = Math.max(Math.abs(sma - ema), params.atrWeight * atr) * params.zoneMarginFactor;
            double lower = Math.min(sma, ema) - margin;
            double upper = Math.max(sma, ema) + margin;

            boolean openIn = inZone(bar.open, lower, upper);
            boolean closeIn = inZone(bar.close, lower, upper);
            SetupKind kind;
            double confidence;
            if (openIn && closeIn) {
                kind = SetupKind.PRIMARY;
                confidence = params.primaryConfidence;
            } else if ((openIn || closeIn) && inZone(bar.bodyMidpoint(), lower, upper)) {
                kind = SetupKind.SECONDARY;
                confidence = params.secondaryConfidence;
            } else {
                continue;
            }
            if (!trendFilter.passes(weekly, bar.date)) {
                continue;
            }
            out.add(new Setup(
                    EntityIds.setupId(bar.date),
                    bar.date,
                    kind,
                    confidence,
                    lower,
                    upper,
                    SetupStatus.ACTIVE
            ));
        }
        return out;
    }

    private boolean inZone(double price, double lower, double upper) {
        return price >= lower && price <= upper;
    }
}
