package com.hwbscan.analysis;

public enum AnalysisMode {
    FULL,
    INCREMENTAL,
    SKIPPED
}
