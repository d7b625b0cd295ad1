package com.hwbscan.pattern;

import com.hwbscan.config.PatternParameters;
import com.hwbscan.model.PriceBar;
import com.hwbscan.model.PriceSeries;

import java.time.LocalDate;

/**
 * Weekly trend gate, evaluated point-in-time. Weekly bars carry the Monday of their
 * week; a week is read only once its Friday is on or before {@code asOf}, so a
 * mid-week date never sees that week's closing values.
 */
public final class TrendFilter {
    static final int WEEK_CLOSE_OFFSET_DAYS = 4;

    private final double minDistance;

    public TrendFilter(PatternParameters params) {
        this.minDistance = params.trendMinWeeklyDistance;
    }

    public boolean passes(PriceSeries weekly, LocalDate asOf) {
        if (weekly == null || weekly.isEmpty() || asOf == null) {
            return false;
        }
        int idx = weekly.lastIndexOnOrBefore(asOf.minusDays(WEEK_CLOSE_OFFSET_DAYS));
        if (idx < 0) {
            return false;
        }
        PriceBar latest = weekly.get(idx);
        if (latest.sma200 == null || latest.sma200 <= 0) {
            return false;
        }
        return (latest.close - latest.sma200) / latest.sma200 >= minDistance;
    }
}
