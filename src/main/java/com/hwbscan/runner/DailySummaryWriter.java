package com.hwbscan.runner;

import com.hwbscan.model.DailySummary;
import com.hwbscan.model.SummaryEntry;
import com.hwbscan.model.SummaryKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes {@code <dir>/<scan_date>.json} and refreshes {@code <dir>/latest.json}.
 */
public final class DailySummaryWriter {
    private static final Logger LOG = LogManager.getLogger(DailySummaryWriter.class);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Path dir;

    public DailySummaryWriter(Path dir) {
        this.dir = dir;
    }

    public Path write(DailySummary summary) throws IOException {
        Files.createDirectories(dir);
        String text = toJson(summary).toString(2);
        Path dated = dir.resolve(summary.scanDate + ".json");
        writeAtomically(dated, text);
        writeAtomically(dir.resolve("latest.json"), text);
        LOG.info("daily summary written: {} (signals={}, candidates={})",
                dated, summary.signals.size(), summary.candidates.size());
        return dated;
    }

    static JSONObject toJson(DailySummary summary) {
        JSONObject root = new JSONObject();
        root.put("scan_date", summary.scanDate.toString());
        root.put("scan_time", summary.scanTime == null ? JSONObject.NULL : summary.scanTime.format(TIME));
        root.put("scan_duration_seconds", summary.scanDurationSeconds);
        root.put("total_scanned", summary.totalScanned);
        root.put("analyzed_count", summary.analyzedCount);
        root.put("no_data_count", summary.noDataCount);
        root.put("failed_count", summary.failedCount);

        JSONObject body = new JSONObject();
        body.put("signals_count", summary.signals.size());
        body.put("candidates_count", summary.candidates.size());
        body.put("signals", entries(summary.signals));
        body.put("candidates", entries(summary.candidates));
        root.put("summary", body);

        JSONObject performance = new JSONObject();
        performance.put("avg_time_per_symbol_ms", summary.avgTimePerSymbolMs);
        root.put("performance", performance);
        return root;
    }

    private static JSONArray entries(List<SummaryEntry> list) {
        JSONArray out = new JSONArray();
        for (SummaryEntry entry : list) {
            JSONObject row = new JSONObject();
            row.put("symbol", entry.symbol);
            row.put("signal_type", entry.kind.label());
            row.put("score", entry.score);
            row.put(entry.kind == SummaryKind.SIGNAL ? "signal_date" : "fvg_date", entry.date.toString());
            row.put("setup_id", entry.setupId);
            row.put("fvg_id", entry.fvgId);
            if (entry.signalId != null) {
                row.put("signal_id", entry.signalId);
            }
            row.put("quality", entry.quality == null ? JSONObject.NULL : entry.quality.name());
            out.put(row);
        }
        return out;
    }

    private void writeAtomically(Path target, String text) throws IOException {
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, text, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
