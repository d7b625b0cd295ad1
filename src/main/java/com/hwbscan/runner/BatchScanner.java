package com.hwbscan.runner;

import com.hwbscan.analysis.SymbolAnalysisResult;
import com.hwbscan.analysis.SymbolAnalyzer;
import com.hwbscan.analysis.SymbolOutcome;
import com.hwbscan.config.ScanSettings;
import com.hwbscan.model.DailySummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;

/**
 * 模块说明：BatchScanner（class）。
 * 主要职责：把股票池切成固定大小的批次，在共享线程池上逐批分析，并汇总成每日结果。
 * 使用建议：单个股票的异常只计入 failed，不会中断整个扫描。
 */
public final class BatchScanner {
    private static final Logger LOG = LogManager.getLogger(BatchScanner.class);

    private final SymbolAnalyzer analyzer;
    private final ScanWorkerPool pool;
    private final ScanSettings settings;
    private final Clock clock;

    public BatchScanner(SymbolAnalyzer analyzer, ScanWorkerPool pool, ScanSettings settings, Clock clock) {
        this.analyzer = analyzer;
        this.pool = pool;
        this.settings = settings;
        this.clock = clock;
    }

    public DailySummary scan(List<String> universe) throws InterruptedException {
        return scan(universe, null);
    }

/**
 * 方法说明：scan，负责执行扫描流程并返回汇总。
 * 处理流程：先校验股票池，再按批次提交任务，按完成顺序收集结果并回调进度。
 * 维护提示：批次之间按 scan.batch_pause_ms 暂停，避免压垮行情数据源。
 */
    public DailySummary scan(List<String> universe, ScanProgressListener listener) throws InterruptedException {
        List<String> symbols = validateUniverse(universe);
        LocalDate scanDate = LocalDate.now(clock);
        LocalTime scanTime = LocalTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        int total = symbols.size();
        long startedNanos = System.nanoTime();

        DailySummaryBuilder summary = new DailySummaryBuilder();
        List<List<String>> batches = segmentByFixedChunk(symbols, settings.batchSize);
        LOG.info("scan started: symbols={} batches={} batch_size={} workers={}",
                total, batches.size(), settings.batchSize, pool.size());

        int completed = 0;
        for (int b = 0; b < batches.size(); b++) {
            completed = scanBatch(batches.get(b), completed, total, summary, listener, startedNanos);
            if (b + 1 < batches.size() && settings.batchPauseMs > 0) {
                Thread.sleep(settings.batchPauseMs);
            }
        }

        DailySummary out = summary.build(scanDate, scanTime, System.nanoTime() - startedNanos, total);
        LOG.info(String.format(
                Locale.US,
                "scan finished: total=%d analyzed=%d no_data=%d failed=%d signals=%d candidates=%d duration=%.1fs avg=%.1fms",
                out.totalScanned,
                out.analyzedCount,
                out.noDataCount,
                out.failedCount,
                out.signals.size(),
                out.candidates.size(),
                out.scanDurationSeconds,
                out.avgTimePerSymbolMs
        ));
        return out;
    }

    private int scanBatch(
            List<String> batch,
            int completedBefore,
            int total,
            DailySummaryBuilder summary,
            ScanProgressListener listener,
            long startedNanos
    ) throws InterruptedException {
        CompletionService<SymbolAnalysisResult> completion = new ExecutorCompletionService<>(pool.executor());
        List<Future<SymbolAnalysisResult>> submitted = new ArrayList<>(batch.size());
        Map<Future<SymbolAnalysisResult>, String> owners = new HashMap<>();
        for (String symbol : batch) {
            Future<SymbolAnalysisResult> future = completion.submit(() -> analyzer.analyze(symbol));
            submitted.add(future);
            owners.put(future, symbol);
        }

        int completed = completedBefore;
        try {
            for (int i = 0; i < batch.size(); i++) {
                Future<SymbolAnalysisResult> future = completion.take();
                String symbol = owners.get(future);
                SymbolAnalysisResult result = null;
                try {
                    result = future.get();
                    record(summary, result);
                } catch (ExecutionException e) {
                    summary.recordFailed();
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.error("analysis failed symbol={}, err={}", symbol, cause.toString(), cause);
                }

                completed++;
                if (listener != null) {
                    listener.onSymbolCompleted(completed, total, symbol, result);
                }
                if (shouldLogProgress(completed, total, settings.progressLogEvery)) {
                    logScanProgress(completed, total, summary, startedNanos);
                }
            }
        } catch (InterruptedException e) {
            for (Future<SymbolAnalysisResult> future : submitted) {
                future.cancel(true);
            }
            throw e;
        }
        return completed;
    }

    private void record(DailySummaryBuilder summary, SymbolAnalysisResult result) {
        if (result == null || result.outcome == SymbolOutcome.NO_DATA) {
            summary.recordNoData();
            return;
        }
        summary.recordAnalyzed();
        summary.addSignals(result.signals);
        summary.addCandidates(result.candidates);
    }

    static List<String> validateUniverse(List<String> universe) {
        if (universe == null) {
            throw new IllegalArgumentException("universe must not be null");
        }
        Set<String> seen = new HashSet<>();
        List<String> out = new ArrayList<>(universe.size());
        for (int i = 0; i < universe.size(); i++) {
            String raw = universe.get(i);
            if (raw == null || raw.trim().isEmpty()) {
                throw new IllegalArgumentException("blank symbol in universe at position " + i);
            }
            String symbol = raw.trim();
            if (!seen.add(symbol.toUpperCase(Locale.ROOT))) {
                throw new IllegalArgumentException("duplicate symbol in universe: " + symbol);
            }
            out.add(symbol);
        }
        return out;
    }

    static List<List<String>> segmentByFixedChunk(List<String> symbols, int chunkSize) {
        int size = chunkSize <= 0 ? 20 : chunkSize;
        List<List<String>> out = new ArrayList<>();
        for (int i = 0; i < symbols.size(); i += size) {
            int to = Math.min(symbols.size(), i + size);
            out.add(new ArrayList<>(symbols.subList(i, to)));
        }
        return out;
    }

    private boolean shouldLogProgress(int completed, int total, int logEvery) {
        if (completed >= total) {
            return true;
        }
        if (logEvery <= 0) {
            return false;
        }
        return completed % logEvery == 0;
    }

    private void logScanProgress(int completed, int total, DailySummaryBuilder summary, long startedNanos) {
        long elapsedSec = Math.max(0L, Math.round((System.nanoTime() - startedNanos) / 1_000_000_000.0));
        int remaining = Math.max(0, total - completed);
        long etaSec = completed <= 0 ? 0L : Math.round(elapsedSec * (remaining / (double) completed));
        double pct = total <= 0 ? 100.0 : completed * 100.0 / total;
        LOG.info(String.format(
                Locale.US,
                "Progress done=%d/%d (%.1f%%) analyzed=%d no_data=%d failed=%d signals=%d candidates=%d elapsed=%s eta=%s",
                completed,
                total,
                pct,
                summary.analyzedCount(),
                summary.noDataCount(),
                summary.failedCount(),
                summary.signalCount(),
                summary.candidateCount(),
                formatSeconds(elapsedSec),
                formatSeconds(etaSec)
        ));
    }

    private String formatSeconds(long seconds) {
        long sec = Math.max(0L, seconds);
        long h = sec / 3600;
        long m = (sec % 3600) / 60;
        long s = sec % 60;
        return String.format(Locale.US, "%02d:%02d:%02d", h, m, s);
    }
}
