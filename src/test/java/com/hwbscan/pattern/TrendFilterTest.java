package com.hwbscan.pattern;

import com.hwbscan.config.PatternParameters;
import com.hwbscan.model.PriceBar;
import com.hwbscan.model.PriceSeries;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrendFilterTest {

    private final TrendFilter filter = new TrendFilter(PatternParameters.defaults());

    @Test
    void passes_shouldRequireCloseAboveWeeklyAverage() {
        LocalDate monday = LocalDate.of(2024, 6, 3);
        PriceSeries weekly = PriceSeries.of(List.of(new PriceBar(monday, 100, 111, 99, 110, 1000, 100.0, null)));

        assertTrue(filter.passes(weekly, monday.plusDays(4)));
    }

    @Test
    void passes_shouldNotReadBarsAfterAsOf() {
        LocalDate monday = LocalDate.of(2024, 6, 3);
        PriceSeries weekly = PriceSeries.of(List.of(
                new PriceBar(monday, 100, 101, 94, 95, 1000, 100.0, null),
                new PriceBar(monday.plusDays(7), 100, 131, 99, 130, 1000, 100.0, null)
        ));

        assertFalse(filter.passes(weekly, monday.plusDays(6)));
        assertFalse(filter.passes(weekly, monday.plusDays(7)));
        assertTrue(filter.passes(weekly, monday.plusDays(11)));
    }

    @Test
    void passes_shouldUsePreviousWeekUntilCurrentWeekCloses() {
        // Monday-dated weeks, the last one closing at 130 on Friday 2024-03-01
        LocalDate lastWeek = LocalDate.of(2024, 2, 26);
        List<PriceBar> bars = new ArrayList<>();
        for (int k = 60; k >= 1; k--) {
            bars.add(new PriceBar(lastWeek.minusWeeks(k), 100, 101, 99, 100, 5000, 100.0, null));
        }
        bars.add(new PriceBar(lastWeek, 100, 131, 99, 130, 5000, 100.5, null));
        PriceSeries weekly = PriceSeries.of(bars);

        assertFalse(filter.passes(weekly, LocalDate.of(2024, 2, 23)));
        assertFalse(filter.passes(weekly, LocalDate.of(2024, 2, 27)));
        assertFalse(filter.passes(weekly, LocalDate.of(2024, 2, 29)));
        assertTrue(filter.passes(weekly, LocalDate.of(2024, 3, 1)));
        assertTrue(filter.passes(weekly, LocalDate.of(2024, 3, 4)));
    }

    @Test
    void passes_shouldFailWithoutWeeklyAverage() {
        LocalDate monday = LocalDate.of(2024, 6, 3);
        PriceSeries weekly = PriceSeries.of(List.of(new PriceBar(monday, 100, 111, 99, 110, 1000)));

        assertFalse(filter.passes(weekly, monday.plusDays(4)));
        assertFalse(filter.passes(PriceSeries.empty(), monday));
        assertFalse(filter.passes(weekly, monday.minusDays(1)));
    }

    @Test
    void passes_shouldFailOnFlatMarket() {
        LocalDate monday = LocalDate.of(2024, 6, 3);
        PriceSeries weekly = PriceSeries.of(List.of(new PriceBar(monday, 100, 101, 99, 100, 1000, 100.0, null)));

        assertFalse(filter.passes(weekly, monday.plusDays(4)));
    }
}
