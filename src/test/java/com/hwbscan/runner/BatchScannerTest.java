package com.hwbscan.runner;

import com.hwbscan.analysis.AnalysisMode;
import com.hwbscan.analysis.SymbolAnalysisResult;
import com.hwbscan.analysis.SymbolAnalyzer;
import com.hwbscan.analysis.SymbolOutcome;
import com.hwbscan.config.ScanSettings;
import com.hwbscan.model.DailySummary;
import com.hwbscan.model.QualityTier;
import com.hwbscan.model.SummaryEntry;
import com.hwbscan.model.SummaryKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchScannerTest {

    private static final LocalDate DAY = LocalDate.of(2024, 6, 14);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-14T21:30:00Z"), ZoneOffset.UTC);

    private final ScanWorkerPool pool = new ScanWorkerPool(3);

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    void scan_shouldIsolateFailuresAndCountOutcomes() throws Exception {
        SymbolAnalyzer analyzer = symbol -> {
            switch (symbol) {
                case "BOOM":
                    throw new IOException("disk full");
                case "NODATA":
                    return SymbolAnalysisResult.noData(symbol);
                case "CRASH":
                    throw new IllegalStateException("bad state");
                default:
                    return analyzed(symbol, List.of(entry(symbol, SummaryKind.SIGNAL, DAY, 70)), List.of());
            }
        };
        BatchScanner scanner = new BatchScanner(analyzer, pool, settings(2), CLOCK);

        DailySummary summary = scanner.scan(List.of("AAPL", "BOOM", "NODATA", "MSFT", "CRASH"));

        assertEquals(5, summary.totalScanned);
        assertEquals(2, summary.analyzedCount);
        assertEquals(1, summary.noDataCount);
        assertEquals(2, summary.failedCount);
        assertEquals(2, summary.signals.size());
        assertEquals(DAY, summary.scanDate);
        assertTrue(summary.avgTimePerSymbolMs >= 0.0);
    }

    @Test
    void scan_shouldReportProgressForEverySymbol() throws Exception {
        List<String> universe = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            universe.add("S" + i);
        }
        List<Integer> completed = Collections.synchronizedList(new ArrayList<>());
        List<String> failedSymbols = Collections.synchronizedList(new ArrayList<>());
        SymbolAnalyzer analyzer = symbol -> {
            if ("S3".equals(symbol)) {
                throw new IllegalStateException("boom");
            }
            return analyzed(symbol, List.of(), List.of());
        };
        BatchScanner scanner = new BatchScanner(analyzer, pool, settings(3), CLOCK);

        scanner.scan(universe, (done, total, symbol, result) -> {
            completed.add(done);
            assertEquals(7, total);
            if (result == null) {
                failedSymbols.add(symbol);
            }
        });

        assertEquals(List.of(1, 2, 3, 4, 5, 6, 7), completed);
        assertEquals(List.of("S3"), failedSymbols);
    }

    @Test
    void scan_shouldFinishBatchBeforeStartingNext() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        SymbolAnalyzer analyzer = symbol -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            return analyzed(symbol, List.of(), List.of());
        };
        BatchScanner scanner = new BatchScanner(analyzer, pool, settings(2), CLOCK);

        DailySummary summary = scanner.scan(List.of("A", "B", "C", "D", "E"));

        assertEquals(5, summary.analyzedCount);
        assertTrue(maxInFlight.get() <= 2);
    }

    @Test
    void scan_shouldRejectInvalidUniverseBeforeAnyWork() {
        AtomicInteger calls = new AtomicInteger();
        SymbolAnalyzer analyzer = symbol -> {
            calls.incrementAndGet();
            return analyzed(symbol, List.of(), List.of());
        };
        BatchScanner scanner = new BatchScanner(analyzer, pool, settings(2), CLOCK);

        assertThrows(IllegalArgumentException.class, () -> scanner.scan(List.of("AAPL", " ", "MSFT")));
        assertThrows(IllegalArgumentException.class, () -> scanner.scan(List.of("AAPL", "MSFT", "aapl")));
        assertEquals(0, calls.get());
    }

    @Test
    void scan_shouldDeduplicateAcrossResults() throws Exception {
        SymbolAnalyzer analyzer = symbol -> analyzed(
                symbol,
                List.of(),
                List.of(entry(symbol, SummaryKind.CANDIDATE, DAY, "AAPL".equals(symbol) ? 40 : 55),
                        entry(symbol, SummaryKind.CANDIDATE, DAY, 20))
        );
        BatchScanner scanner = new BatchScanner(analyzer, pool, settings(1), CLOCK);

        DailySummary summary = scanner.scan(List.of("AAPL", "MSFT"));

        assertEquals(2, summary.candidates.size());
        assertEquals("MSFT", summary.candidates.get(0).symbol);
        assertEquals(55, summary.candidates.get(0).score);
        assertEquals(40, summary.candidates.get(1).score);
    }

    @Test
    void segmentByFixedChunk_shouldKeepRemainderInLastBatch() {
        List<List<String>> batches = BatchScanner.segmentByFixedChunk(List.of("A", "B", "C", "D", "E"), 2);

        assertEquals(3, batches.size());
        assertEquals(List.of("E"), batches.get(2));
    }

    @Test
    void scan_shouldHandleEmptyUniverse() throws Exception {
        BatchScanner scanner = new BatchScanner(symbol -> null, pool, settings(2), CLOCK);

        DailySummary summary = scanner.scan(List.of());

        assertEquals(0, summary.totalScanned);
        assertEquals(0.0, summary.avgTimePerSymbolMs, 1e-9);
        assertTrue(summary.signals.isEmpty());
    }

    private ScanSettings settings(int batchSize) {
        return ScanSettings.builder()
                .batchSize(batchSize)
                .workers(3)
                .batchPauseMs(0)
                .progressLogEvery(2)
                .lookbackYears(10)
                .maxUniverseSize(0)
                .dataDir(Path.of("data"))
                .build();
    }

    static SymbolAnalysisResult analyzed(String symbol, List<SummaryEntry> signals, List<SummaryEntry> candidates) {
        return new SymbolAnalysisResult(symbol, SymbolOutcome.ANALYZED, AnalysisMode.FULL, true, signals, candidates);
    }

    static SummaryEntry entry(String symbol, SummaryKind kind, LocalDate date, int score) {
        return new SummaryEntry(symbol, kind, date, score, "setup_x", "fvg_x", null, QualityTier.MEDIUM);
    }
}
