package com.hwbscan.cache;

import com.hwbscan.model.PriceHistory;

import java.sql.SQLException;
import java.util.Optional;

/**
 * Read side of the price cache as seen by the analyzer. Empty means the symbol has no data.
 */
public interface PriceHistorySource {
    Optional<PriceHistory> getSeries(String symbol, int lookbackYears) throws SQLException;
}
