package com.hwbscan.pattern;

import com.hwbscan.config.PatternParameters;
import com.hwbscan.indicator.IndicatorEngine;
import com.hwbscan.model.BreakoutOutcome;
import com.hwbscan.model.Gap;
import com.hwbscan.model.PriceSeries;
import com.hwbscan.model.Setup;

import java.time.LocalDate;
import java.util.List;

/**
 * Stateless facade over the four rules. Pure function of series and parameters.
 */
public final class PatternEngine {
    private final PatternParameters params;
    private final TrendFilter trendFilter;
    private final SetupFinder setupFinder;
    private final GapFinder gapFinder;
    private final BreakoutFinder breakoutFinder;

    public PatternEngine(PatternParameters params) {
        this(params, new IndicatorEngine(params));
    }

    public PatternEngine(PatternParameters params, IndicatorEngine indicators) {
        this.params = params;
        this.trendFilter = new TrendFilter(params);
        this.setupFinder = new SetupFinder(params, indicators, trendFilter);
        this.gapFinder = new GapFinder(params, indicators);
        this.breakoutFinder = new BreakoutFinder(params, indicators);
    }

    public PatternParameters parameters() {
        return params;
    }

    public boolean trendPasses(PriceSeries weekly, LocalDate asOf) {
        return trendFilter.passes(weekly, asOf);
    }

    public List<Setup> findSetups(PriceSeries daily, PriceSeries weekly, int fromIndex, int toIndex) {
        return setupFinder.find(daily, weekly, fromIndex, toIndex);
    }

    public List<Gap> findGaps(PriceSeries daily, Setup setup, int fromIndex, int toIndex) {
        return gapFinder.find(daily, setup, fromIndex, toIndex);
    }

    public BreakoutOutcome evaluateBreakout(PriceSeries daily, Setup setup, Gap gap, int scanFromIndex) {
        return breakoutFinder.evaluate(daily, setup, gap, scanFromIndex);
    }
}
