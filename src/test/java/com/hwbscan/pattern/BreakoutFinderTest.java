package com.hwbscan.pattern;

import com.hwbscan.config.PatternParameters;
import com.hwbscan.indicator.IndicatorEngine;
import com.hwbscan.model.BreakoutOutcome;
import com.hwbscan.model.Gap;
import com.hwbscan.model.PriceBar;
import com.hwbscan.model.PriceSeries;
import com.hwbscan.model.SeriesLookupException;
import com.hwbscan.model.Setup;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BreakoutFinderTest {

    private final PatternParameters params = PatternParameters.defaults();
    private final IndicatorEngine indicators = new IndicatorEngine(params);
    private final BreakoutFinder finder = new BreakoutFinder(params, indicators);
    private final GapFinder gapFinder = new GapFinder(params, indicators);

    @Test
    void resistance_shouldBeMedianOfFourLevels() {
        PriceSeries daily = HwbScenario.daily(HwbScenario.BREAKOUT_INDEX);

        double resistance = finder.resistance(daily, HwbScenario.SETUP_INDEX, HwbScenario.FIRST_GAP_INDEX);

        // levels: vwap 102.79, pivot 104.67, max close 107, max high 108
        assertEquals((104.0 + 2.0 / 3.0 + 107.0) / 2.0, resistance, 1e-6);
    }

    @Test
    void evaluate_shouldReportBreakoutOnHighVolumeClose() {
        PriceSeries daily = HwbScenario.daily(HwbScenario.BREAKOUT_INDEX);
        Setup setup = GapFinderTest.scenarioSetup();
        Gap gap = firstGap(daily, setup);

        BreakoutOutcome outcome = finder.evaluate(daily, setup, gap);

        assertTrue(outcome.isBreakout());
        assertEquals(HwbScenario.dateOf(HwbScenario.BREAKOUT_INDEX), outcome.date);
        assertEquals(112.0, outcome.price, 1e-9);
        assertEquals(6, outcome.score);
        assertTrue(outcome.breakoutPercentage() > 0);
    }

    @Test
    void evaluate_shouldReturnNoneBeforeBreakoutBar() {
        PriceSeries daily = HwbScenario.daily(HwbScenario.BREAKOUT_INDEX - 1);
        Setup setup = GapFinderTest.scenarioSetup();

        BreakoutOutcome outcome = finder.evaluate(daily, setup, firstGap(daily, setup));

        assertFalse(outcome.isBreakout());
        assertFalse(outcome.isViolated());
    }

    @Test
    void evaluate_shouldCheckViolationBeforeBreakoutOnSameBar() {
        List<PriceBar> bars = new ArrayList<>(HwbScenario.daily(HwbScenario.BREAKOUT_INDEX - 1).bars());
        bars.add(HwbScenario.bar(HwbScenario.dateOf(HwbScenario.BREAKOUT_INDEX), 107, 113, 95, 112, 3000));
        PriceSeries daily = PriceSeries.of(bars);
        Setup setup = GapFinderTest.scenarioSetup();

        BreakoutOutcome outcome = finder.evaluate(daily, setup, firstGap(daily, setup));

        assertTrue(outcome.isViolated());
        assertEquals(HwbScenario.dateOf(HwbScenario.BREAKOUT_INDEX), outcome.date);
    }

    @Test
    void evaluate_shouldStopAtEarlierViolation() {
        List<PriceBar> bars = new ArrayList<>(HwbScenario.daily(HwbScenario.BREAKOUT_INDEX).bars());
        bars.set(25, HwbScenario.bar(HwbScenario.dateOf(25), 107, 107.5, 90, 107, 1000));
        PriceSeries daily = PriceSeries.of(bars);
        Setup setup = GapFinderTest.scenarioSetup();
        Gap gap = gapFinder.find(HwbScenario.daily(HwbScenario.BREAKOUT_INDEX), setup).get(0);

        BreakoutOutcome outcome = finder.evaluate(daily, setup, gap);

        assertTrue(outcome.isViolated());
        assertEquals(HwbScenario.dateOf(25), outcome.date);
    }

    @Test
    void evaluate_shouldSkipBarsBeforeScanStart() {
        PriceSeries daily = HwbScenario.daily(HwbScenario.BREAKOUT_INDEX);
        Setup setup = GapFinderTest.scenarioSetup();

        BreakoutOutcome outcome = finder.evaluate(daily, setup, firstGap(daily, setup), HwbScenario.BREAKOUT_INDEX + 1);

        assertEquals(BreakoutOutcome.Kind.NONE, outcome.kind);
    }

    @Test
    void evaluate_shouldThrowWhenGapDateMissing() {
        PriceSeries full = HwbScenario.daily(HwbScenario.BREAKOUT_INDEX);
        Setup setup = GapFinderTest.scenarioSetup();
        Gap gap = firstGap(full, setup);
        PriceSeries truncated = HwbScenario.daily(HwbScenario.SETUP_INDEX + 1);

        assertThrows(SeriesLookupException.class, () -> finder.evaluate(truncated, setup, gap));
    }

    private Gap firstGap(PriceSeries daily, Setup setup) {
        return gapFinder.find(daily, setup).stream()
                .filter(g -> g.formationDate.equals(HwbScenario.dateOf(HwbScenario.FIRST_GAP_INDEX)))
                .findFirst()
                .orElseThrow();
    }
}
