package com.hwbscan.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class DailySummary {
    public final LocalDate scanDate;
    public final LocalTime scanTime;
    public final double scanDurationSeconds;
    public final int totalScanned;
    public final int analyzedCount;
    public final int noDataCount;
    public final int failedCount;
    public final List<SummaryEntry> signals;
    public final List<SummaryEntry> candidates;
    public final double avgTimePerSymbolMs;
}
