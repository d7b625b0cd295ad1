package com.hwbscan.data;

public enum BarInterval {
    DAILY("d"),
    WEEKLY("w");

    private final String code;

    BarInterval(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
