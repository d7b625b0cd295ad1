package com.hwbscan.state;

import com.hwbscan.model.SymbolState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * One JSON document per symbol under {@code <dir>/<SYMBOL>.json}. Writes go through
 * a temp file and a move, so readers see either the old or the new document.
 */
public final class JsonFileSymbolStateStore implements SymbolStateStore {
    private static final Logger LOG = LogManager.getLogger(JsonFileSymbolStateStore.class);

    private final Path dir;

    public JsonFileSymbolStateStore(Path dir) {
        this.dir = dir;
    }

    @Override
    public Optional<SymbolState> load(String symbol) throws IOException {
        Path path = pathOf(symbol);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        String text = Files.readString(path, StandardCharsets.UTF_8);
        try {
            return Optional.of(SymbolStateJson.fromJson(new JSONObject(text)));
        } catch (JSONException | IllegalArgumentException | DateTimeParseException e) {
            LOG.warn("corrupt state document {}, treating as absent: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(String symbol, SymbolState state) throws IOException {
        Files.createDirectories(dir);
        Path target = pathOf(symbol);
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, SymbolStateJson.toJson(state).toString(2), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    Path pathOf(String symbol) {
        String safe = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9._-]", "_");
        if (safe.isEmpty()) {
            throw new IllegalArgumentException("symbol must not be empty");
        }
        return dir.resolve(safe + ".json");
    }
}
