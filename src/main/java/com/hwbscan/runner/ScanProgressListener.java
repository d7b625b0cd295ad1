package com.hwbscan.runner;

import com.hwbscan.analysis.SymbolAnalysisResult;

/**
 * Called on the scanning thread after each symbol finishes. {@code result} is null
 * when the symbol failed.
 */
@FunctionalInterface
public interface ScanProgressListener {
    void onSymbolCompleted(int completed, int total, String symbol, SymbolAnalysisResult result);
}
