package com.hwbscan.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PriceSeriesTest {

    private static final LocalDate D1 = LocalDate.of(2024, 2, 5);
    private static final LocalDate D2 = D1.plusDays(1);
    private static final LocalDate D3 = D1.plusDays(2);

    @Test
    void of_shouldSortAndKeepLastBarPerDate() {
        PriceSeries series = PriceSeries.of(List.of(
                new PriceBar(D3, 3, 3, 3, 3, 30),
                new PriceBar(D1, 1, 1, 1, 1, 10),
                new PriceBar(D3, 4, 4, 4, 4, 40)
        ));

        assertEquals(2, series.size());
        assertEquals(D1, series.first().date);
        assertEquals(4.0, series.last().close, 1e-9);
    }

    @Test
    void merge_shouldPreferNewerBars() {
        PriceSeries stored = PriceSeries.of(List.of(
                new PriceBar(D1, 1, 1, 1, 1, 10),
                new PriceBar(D2, 2, 2, 2, 2, 20)
        ));
        PriceSeries fetched = PriceSeries.of(List.of(
                new PriceBar(D2, 5, 5, 5, 5, 50),
                new PriceBar(D3, 6, 6, 6, 6, 60)
        ));

        PriceSeries merged = stored.merge(fetched);

        assertEquals(3, merged.size());
        assertEquals(5.0, merged.get(1).close, 1e-9);
        assertEquals(D3, merged.last().date);
    }

    @Test
    void lookups_shouldUseDates() {
        PriceSeries series = PriceSeries.of(List.of(
                new PriceBar(D1, 1, 1, 1, 1, 10),
                new PriceBar(D3, 3, 3, 3, 3, 30)
        ));

        assertEquals(1, series.requireIndex(D3));
        assertFalse(series.indexOf(D2).isPresent());
        assertEquals(1, series.firstIndexAfter(D1));
        assertEquals(1, series.firstIndexAfter(D2));
        assertEquals(2, series.firstIndexAfter(D3));
        assertEquals(0, series.lastIndexOnOrBefore(D2));
        assertEquals(-1, series.lastIndexOnOrBefore(D1.minusDays(1)));
        SeriesLookupException e = assertThrows(SeriesLookupException.class, () -> series.requireIndex(D2));
        assertEquals(D2, e.date());
    }

    @Test
    void firstIndexWithAverages_shouldSkipWarmup() {
        PriceSeries series = PriceSeries.of(List.of(
                new PriceBar(D1, 1, 1, 1, 1, 10),
                new PriceBar(D2, 2, 2, 2, 2, 20, 2.0, 2.0),
                new PriceBar(D3, 3, 3, 3, 3, 30, 2.5, 2.4)
        ));

        assertEquals(1, series.firstIndexWithAverages());
        assertTrue(series.get(2).hasAverages());
    }
}
