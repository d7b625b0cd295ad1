package com.hwbscan.model;

public enum QualityTier {
    LOW,
    MEDIUM,
    HIGH;

    public static QualityTier forGapScore(int score) {
        if (score >= 6) {
            return HIGH;
        }
        if (score >= 4) {
            return MEDIUM;
        }
        return LOW;
    }

    public static QualityTier forBreakoutScore(int score) {
        if (score >= 6) {
            return HIGH;
        }
        if (score >= 5) {
            return MEDIUM;
        }
        return LOW;
    }

    public static QualityTier fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return LOW;
        }
        return QualityTier.valueOf(raw.trim().toUpperCase());
    }
}
