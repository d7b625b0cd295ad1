package com.hwbscan.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Daily and weekly series of one symbol as read back from the cache.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public final class PriceHistory {
    public final String symbol;
    public final PriceSeries daily;
    public final PriceSeries weekly;
}
