package com.hwbscan.model;

public enum SummaryKind {
    SIGNAL("s2_breakout"),
    CANDIDATE("s1_fvg");

    private final String label;

    SummaryKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
