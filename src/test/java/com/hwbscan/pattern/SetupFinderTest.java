package com.hwbscan.pattern;

import com.hwbscan.config.PatternParameters;
import com.hwbscan.indicator.IndicatorEngine;
import com.hwbscan.model.PriceBar;
import com.hwbscan.model.PriceSeries;
import com.hwbscan.model.Setup;
import com.hwbscan.model.SetupKind;
import com.hwbscan.model.SetupStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SetupFinderTest {

    private final PatternParameters params = PatternParameters.defaults();
    private final IndicatorEngine indicators = new IndicatorEngine(params);
    private final SetupFinder finder = new SetupFinder(params, indicators, new TrendFilter(params));

    @Test
    void find_shouldReturnNothingForFlatMarket() {
        LocalDate start = LocalDate.of(2023, 1, 2);
        PriceSeries daily = indicators.withDailyAverages(buildDaily(start, 201, 100.0));
        PriceSeries weekly = indicators.withWeeklyAverages(buildWeekly(start.plusDays(200), 61, 100.0));

        List<Setup> setups = finder.find(daily, weekly, 0, daily.lastIndex());

        assertTrue(setups.isEmpty());
    }

    @Test
    void find_shouldDetectPrimarySetupWhenBodyInsideZoneAndTrendPasses() {
        LocalDate start = LocalDate.of(2023, 1, 2);
        List<PriceBar> raw = new ArrayList<>(buildDaily(start, 200, 100.0).bars());
        LocalDate setupDate = start.plusDays(200);
        raw.add(new PriceBar(setupDate, 100.0, 102.0, 98.0, 100.2, 1000));
        PriceSeries daily = indicators.withDailyAverages(PriceSeries.of(raw));

        LocalDate risingWeek = setupDate.minusDays(TrendFilter.WEEK_CLOSE_OFFSET_DAYS);
        List<PriceBar> weeklyRaw = new ArrayList<>(buildWeekly(risingWeek.minusDays(7), 60, 100.0).bars());
        weeklyRaw.add(new PriceBar(risingWeek, 100.0, 131.0, 99.0, 130.0, 5000));
        PriceSeries weekly = indicators.withWeeklyAverages(PriceSeries.of(weeklyRaw));

        List<Setup> setups = finder.find(daily, weekly, 0, daily.lastIndex());

        assertEquals(1, setups.size());
        Setup setup = setups.get(0);
        assertEquals(setupDate, setup.date);
        assertEquals(SetupKind.PRIMARY, setup.kind);
        assertEquals(0.85, setup.confidence, 1e-9);
        assertEquals(SetupStatus.ACTIVE, setup.status);
        assertEquals("setup_" + setupDate.toString().replace("-", ""), setup.id);
        assertEquals(99.601, setup.zoneLower, 1e-3);
        assertEquals(100.402, setup.zoneUpper, 1e-3);
    }

    @Test
    void find_shouldClassifySecondaryWhenOnlyOneEndAndMidpointInZone() {
        LocalDate start = LocalDate.of(2024, 3, 1);
        List<PriceBar> raw = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            raw.add(new PriceBar(start.plusDays(i), 100, 101, 99, 100, 1000, 100.0, 100.0));
        }
        // zone is [99.8, 100.2]: open inside, close outside, midpoint 100.15 inside
        raw.add(new PriceBar(start.plusDays(20), 100.0, 101, 99, 100.3, 1000, 100.0, 100.0));
        PriceSeries daily = PriceSeries.of(raw);
        PriceSeries weekly = PriceSeries.of(List.of(
                new PriceBar(start.minusDays(7), 100, 131, 99, 130, 5000, 100.0, null)
        ));

        List<Setup> setups = finder.find(daily, weekly, 20, 20);

        assertEquals(1, setups.size());
        assertEquals(SetupKind.SECONDARY, setups.get(0).kind);
        assertEquals(0.65, setups.get(0).confidence, 1e-9);
    }

    @Test
    void find_shouldRejectCandidateWhenTrendFails() {
        PriceSeries daily = HwbScenario.daily(HwbScenario.SETUP_INDEX);
        PriceSeries weekly = PriceSeries.of(List.of(
                new PriceBar(HwbScenario.dateOf(0), 100, 101, 99, 95, 5000, 100.0, null)
        ));

        assertTrue(finder.find(daily, weekly, 0, daily.lastIndex()).isEmpty());
    }

    @Test
    void find_shouldOnlyReportScenarioSetup() {
        PriceSeries daily = HwbScenario.daily(HwbScenario.BREAKOUT_INDEX);

        List<Setup> setups = finder.find(daily, HwbScenario.weekly(), 0, daily.lastIndex());

        assertEquals(1, setups.size());
        assertEquals(HwbScenario.dateOf(HwbScenario.SETUP_INDEX), setups.get(0).date);
        assertEquals(SetupKind.PRIMARY, setups.get(0).kind);
    }

    private PriceSeries buildDaily(LocalDate start, int count, double price) {
        List<PriceBar> bars = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            bars.add(new PriceBar(start.plusDays(i), price, price + 2, price - 2, price, 1000));
        }
        return PriceSeries.of(bars);
    }

    private PriceSeries buildWeekly(LocalDate last, int count, double price) {
        List<PriceBar> bars = new ArrayList<>();
        for (int k = count - 1; k >= 0; k--) {
            bars.add(new PriceBar(last.minusDays(7L * k), price, price + 1, price - 1, price, 5000));
        }
        return PriceSeries.of(bars);
    }
}
