package com.hwbscan.data;

import com.hwbscan.model.PriceBar;

import java.time.LocalDate;
import java.util.List;

/**
 * Historical OHLCV source. Weekly bars are dated by the Monday of their week.
 * An empty list means the provider has no rows for the range.
 */
public interface PriceHistoryProvider {
    List<PriceBar> fetchHistory(String symbol, LocalDate start, LocalDate end, BarInterval interval) throws FetchException;
}
