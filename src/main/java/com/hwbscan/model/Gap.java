package com.hwbscan.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Three-bar fair value gap: {@code lowerBound} is candle1's high and
 * {@code upperBound} candle3's low.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Gap {
    public final String id;
    public final String setupId;
    public final LocalDate formationDate;
    public final double lowerBound;
    public final double upperBound;
    public final double gapPercentage;
    public final int score;
    public final QualityTier quality;
    public final GapStatus status;
    public final LocalDate violationDate;

    public boolean isActive() {
        return status == GapStatus.ACTIVE;
    }

    public Gap consume() {
        return toBuilder().status(status.consume()).build();
    }

    public Gap violate(LocalDate date) {
        return toBuilder().status(status.violate()).violationDate(date).build();
    }
}
