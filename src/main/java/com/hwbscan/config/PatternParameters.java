package com.hwbscan.config;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.Map;

/**
 * Immutable thresholds for the four pattern rules. Built once from {@link Config}
 * and handed to the pattern finders at construction.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PatternParameters {
    public final int maPeriod;
    public final int maMinPeriods;
    public final int volatilityWindow;

    public final double trendMinWeeklyDistance;

    public final double zoneMarginFactor;
    public final double atrWeight;
    public final double primaryConfidence;
    public final double secondaryConfidence;
    public final int setupRecentBars;

    public final int gapMaxSearchDays;
    public final double minGapPct;
    public final int gapMinScore;
    public final double gapSizeTierHighPct;
    public final double gapSizeTierMidPct;
    public final double volumeSurgeStrong;
    public final double volumeSurgeWeak;
    public final double proximityBase;
    public final double proximityCap;

    public final int resistanceLookback;
    public final double breakoutBaseThreshold;
    public final double breakoutThresholdCap;
    public final double violationTolerance;
    public final double volumeConfirmRatio;
    public final int momentumBars;
    public final int breakoutMinScore;

    public final int signalRecentBars;

    public static PatternParameters defaults() {
        return fromConfig(Config.fromMap(Path.of("."), Map.of()));
    }

    public static PatternParameters fromConfig(Config config) {
        PatternParameters params = PatternParameters.builder()
                .maPeriod(config.requireInt("indicator.ma_period"))
                .maMinPeriods(config.requireInt("indicator.ma_min_periods"))
                .volatilityWindow(config.requireInt("volatility.window"))
                .trendMinWeeklyDistance(config.requireDouble("trend.min_weekly_distance"))
                .zoneMarginFactor(config.requireDouble("setup.zone_margin_factor"))
                .atrWeight(config.requireDouble("setup.atr_weight"))
                .primaryConfidence(config.requireDouble("setup.primary_confidence"))
                .secondaryConfidence(config.requireDouble("setup.secondary_confidence"))
                .setupRecentBars(config.requireInt("setup.recent_bars"))
                .gapMaxSearchDays(config.requireInt("gap.max_search_days"))
                .minGapPct(config.requireDouble("gap.min_gap_pct"))
                .gapMinScore(config.requireInt("gap.min_score"))
                .gapSizeTierHighPct(config.requireDouble("gap.size_tier_high_pct"))
                .gapSizeTierMidPct(config.requireDouble("gap.size_tier_mid_pct"))
                .volumeSurgeStrong(config.requireDouble("gap.volume_surge_strong"))
                .volumeSurgeWeak(config.requireDouble("gap.volume_surge_weak"))
                .proximityBase(config.requireDouble("gap.proximity_base"))
                .proximityCap(config.requireDouble("gap.proximity_cap"))
                .resistanceLookback(config.requireInt("breakout.resistance_lookback"))
                .breakoutBaseThreshold(config.requireDouble("breakout.base_threshold"))
                .breakoutThresholdCap(config.requireDouble("breakout.threshold_cap"))
                .violationTolerance(config.requireDouble("breakout.violation_tolerance"))
                .volumeConfirmRatio(config.requireDouble("breakout.volume_confirm_ratio"))
                .momentumBars(config.requireInt("breakout.momentum_bars"))
                .breakoutMinScore(config.requireInt("breakout.min_score"))
                .signalRecentBars(config.requireInt("summary.signal_recent_bars"))
                .build();
        params.validate();
        return params;
    }

    public void validate() {
        requirePositive("indicator.ma_period", maPeriod);
        requirePositive("indicator.ma_min_periods", maMinPeriods);
        if (maMinPeriods > maPeriod) {
            throw new IllegalArgumentException("indicator.ma_min_periods must not exceed indicator.ma_period");
        }
        requirePositive("volatility.window", volatilityWindow);
        requireNonNegative("setup.zone_margin_factor", zoneMarginFactor);
        requireNonNegative("setup.atr_weight", atrWeight);
        requireUnit("setup.primary_confidence", primaryConfidence);
        requireUnit("setup.secondary_confidence", secondaryConfidence);
        requirePositive("setup.recent_bars", setupRecentBars);
        if (gapMaxSearchDays < 2) {
            throw new IllegalArgumentException("gap.max_search_days must be >= 2");
        }
        requireNonNegative("gap.min_gap_pct", minGapPct);
        requireNonNegative("gap.min_score", gapMinScore);
        if (gapSizeTierMidPct > gapSizeTierHighPct) {
            throw new IllegalArgumentException("gap.size_tier_mid_pct must not exceed gap.size_tier_high_pct");
        }
        if (volumeSurgeWeak > volumeSurgeStrong) {
            throw new IllegalArgumentException("gap.volume_surge_weak must not exceed gap.volume_surge_strong");
        }
        requireNonNegative("gap.proximity_base", proximityBase);
        if (proximityCap < proximityBase) {
            throw new IllegalArgumentException("gap.proximity_cap must be >= gap.proximity_base");
        }
        requirePositive("breakout.resistance_lookback", resistanceLookback);
        requireNonNegative("breakout.base_threshold", breakoutBaseThreshold);
        if (breakoutThresholdCap < breakoutBaseThreshold) {
            throw new IllegalArgumentException("breakout.threshold_cap must be >= breakout.base_threshold");
        }
        requireUnit("breakout.violation_tolerance", violationTolerance);
        requireNonNegative("breakout.volume_confirm_ratio", volumeConfirmRatio);
        requirePositive("breakout.momentum_bars", momentumBars);
        requireNonNegative("breakout.min_score", breakoutMinScore);
        requirePositive("summary.signal_recent_bars", signalRecentBars);
    }

    private static void requirePositive(String key, double value) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(key + " must be > 0, got " + value);
        }
    }

    private static void requireNonNegative(String key, double value) {
        if (!(value >= 0)) {
            throw new IllegalArgumentException(key + " must be >= 0, got " + value);
        }
    }

    private static void requireUnit(String key, double value) {
        if (!(value >= 0 && value <= 1)) {
            throw new IllegalArgumentException(key + " must be within [0, 1], got " + value);
        }
    }
}
