package com.hwbscan.model;

public enum SetupKind {
    PRIMARY,
    SECONDARY;

    public static SetupKind fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("setup kind must not be empty");
        }
        return SetupKind.valueOf(raw.trim().toUpperCase());
    }
}
