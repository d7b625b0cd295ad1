package com.hwbscan.db;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class CacheMetadata {
    public final String symbol;
    public final LocalDate firstDate;
    public final LocalDate lastDate;
    public final Instant lastUpdated;
    public final int dailyCount;
    public final int weeklyCount;
}
