package com.hwbscan.analysis;

public enum SymbolOutcome {
    ANALYZED,
    NO_DATA
}
