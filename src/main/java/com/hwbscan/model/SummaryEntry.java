package com.hwbscan.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One ranked row of the daily summary. {@code date} is the breakout date for
 * signals and the gap formation date for candidates.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SummaryEntry {
    public final String symbol;
    public final SummaryKind kind;
    public final LocalDate date;
    public final int score;
    public final String setupId;
    public final String fvgId;
    public final String signalId;
    public final QualityTier quality;
}
