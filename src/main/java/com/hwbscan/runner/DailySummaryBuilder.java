package com.hwbscan.runner;

import com.hwbscan.model.DailySummary;
import com.hwbscan.model.SummaryEntry;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects per-symbol entries during a scan and produces the ranked summary.
 * Not thread-safe; the scanner feeds it from its collecting thread only.
 */
public final class DailySummaryBuilder {
    private static final Comparator<SummaryEntry> RANKING = Comparator
            .comparingInt((SummaryEntry e) -> e.score).reversed()
            .thenComparing(e -> e.symbol)
            .thenComparing(e -> e.date);

    private final List<SummaryEntry> signals = new ArrayList<>();
    private final List<SummaryEntry> candidates = new ArrayList<>();
    private int analyzed;
    private int noData;
    private int failed;

    public void addSignals(List<SummaryEntry> entries) {
        if (entries != null) {
            signals.addAll(entries);
        }
    }

    public void addCandidates(List<SummaryEntry> entries) {
        if (entries != null) {
            candidates.addAll(entries);
        }
    }

    public void recordAnalyzed() {
        analyzed++;
    }

    public void recordNoData() {
        noData++;
    }

    public void recordFailed() {
        failed++;
    }

    public int analyzedCount() {
        return analyzed;
    }

    public int noDataCount() {
        return noData;
    }

    public int failedCount() {
        return failed;
    }

    public int signalCount() {
        return signals.size();
    }

    public int candidateCount() {
        return candidates.size();
    }

    public DailySummary build(LocalDate scanDate, LocalTime scanTime, long elapsedNanos, int totalScanned) {
        double durationSec = Math.max(0L, elapsedNanos) / 1_000_000_000.0;
        double avgMs = totalScanned <= 0 ? 0.0 : Math.max(0L, elapsedNanos) / 1_000_000.0 / totalScanned;
        return DailySummary.builder()
                .scanDate(scanDate)
                .scanTime(scanTime)
                .scanDurationSeconds(durationSec)
                .totalScanned(totalScanned)
                .analyzedCount(analyzed)
                .noDataCount(noData)
                .failedCount(failed)
                .signals(rank(signals))
                .candidates(rank(candidates))
                .avgTimePerSymbolMs(avgMs)
                .build();
    }

    /**
     * Keeps one entry per (symbol, date), the higher score winning; ties keep the
     * first seen. Result is ordered by score descending.
     */
    static List<SummaryEntry> rank(List<SummaryEntry> entries) {
        Map<String, SummaryEntry> best = new LinkedHashMap<>();
        for (SummaryEntry entry : entries) {
            String key = entry.symbol + "|" + entry.date;
            SummaryEntry prior = best.get(key);
            if (prior == null || entry.score > prior.score) {
                best.put(key, entry);
            }
        }
        List<SummaryEntry> out = new ArrayList<>(best.values());
        out.sort(RANKING);
        return List.copyOf(out);
    }
}
