package com.hwbscan.analysis;

import com.hwbscan.model.SummaryEntry;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SymbolAnalysisResult {
    public final String symbol;
    public final SymbolOutcome outcome;
    public final AnalysisMode mode;
    public final boolean changed;
    public final List<SummaryEntry> signals;
    public final List<SummaryEntry> candidates;

    public static SymbolAnalysisResult noData(String symbol) {
        return new SymbolAnalysisResult(symbol, SymbolOutcome.NO_DATA, AnalysisMode.SKIPPED, false, List.of(), List.of());
    }
}
