package com.hwbscan.state;

import com.hwbscan.model.BreakoutOutcome;
import com.hwbscan.model.Gap;
import com.hwbscan.model.GapStatus;
import com.hwbscan.model.QualityTier;
import com.hwbscan.model.Setup;
import com.hwbscan.model.SetupKind;
import com.hwbscan.model.SetupStatus;
import com.hwbscan.model.Signal;
import com.hwbscan.model.SymbolState;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileSymbolStateStoreTest {

    @TempDir
    Path dir;

    @Test
    void save_shouldPersistAllEntitiesAndReloadThem() throws Exception {
        JsonFileSymbolStateStore store = new JsonFileSymbolStateStore(dir);
        SymbolState state = sampleState();

        store.save("MSFT", state);
        SymbolState loaded = store.load("MSFT").orElseThrow();

        assertEquals("MSFT", loaded.getSymbol());
        assertEquals(state.getLastAnalyzedDate(), loaded.getLastAnalyzedDate());
        assertEquals(state.getLastUpdated(), loaded.getLastUpdated());
        assertEquals(state.setups(), loaded.setups());
        assertEquals(state.gaps(), loaded.gaps());
        assertEquals(state.signals(), loaded.signals());
        assertEquals(GapStatus.VIOLATED, loaded.findGap("fvg_20240307_20240304").orElseThrow().status);
    }

    @Test
    void save_shouldWriteDocumentSchemaAndLeaveNoTempFiles() throws Exception {
        JsonFileSymbolStateStore store = new JsonFileSymbolStateStore(dir);

        store.save("msft", sampleState());

        Path doc = dir.resolve("MSFT.json");
        assertTrue(Files.exists(doc));
        JSONObject root = new JSONObject(Files.readString(doc, StandardCharsets.UTF_8));
        assertEquals("2024-03-15", root.getString("last_analyzed_date"));
        assertEquals(1, root.getJSONArray("setups").length());
        assertEquals(2, root.getJSONArray("fvgs").length());
        assertEquals("consumed", root.getJSONArray("setups").getJSONObject(0).getString("status"));
        assertEquals("signal_20240312_20240304", root.getJSONArray("signals").getJSONObject(0).getString("id"));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void load_shouldTreatCorruptDocumentAsAbsent() throws Exception {
        Files.writeString(dir.resolve("BAD.json"), "{\"symbol\": \"BAD\", \"setups\": [", StandardCharsets.UTF_8);
        JsonFileSymbolStateStore store = new JsonFileSymbolStateStore(dir);

        assertFalse(store.load("BAD").isPresent());
    }

    @Test
    void load_shouldReturnEmptyForUnknownSymbol() throws Exception {
        Optional<SymbolState> missing = new JsonFileSymbolStateStore(dir).load("NONE");

        assertFalse(missing.isPresent());
    }

    @Test
    void fromJson_shouldAcceptDocumentWithoutOptionalFields() {
        JSONObject root = new JSONObject()
                .put("symbol", "IBM")
                .put("setups", new JSONArray().put(new JSONObject()
                        .put("id", "setup_20240102")
                        .put("date", "2024-01-02")
                        .put("type", "SECONDARY")
                        .put("confidence", 0.65)
                        .put("status", "active")));

        SymbolState state = SymbolStateJson.fromJson(root);

        assertNull(state.getLastAnalyzedDate());
        assertEquals(SetupKind.SECONDARY, state.setups().get(0).kind);
        assertTrue(state.gaps().isEmpty());
    }

    private SymbolState sampleState() {
        LocalDate setupDate = LocalDate.of(2024, 3, 4);
        Setup setup = new Setup("setup_20240304", setupDate, SetupKind.PRIMARY, 0.85, 99.6, 100.4, SetupStatus.ACTIVE);
        Gap broken = new Gap("fvg_20240306_20240304", setup.id, setupDate.plusDays(2),
                101.0, 104.0, 2.97, 5, QualityTier.MEDIUM, GapStatus.ACTIVE, null);
        Gap violated = new Gap("fvg_20240307_20240304", setup.id, setupDate.plusDays(3),
                102.0, 103.5, 1.47, 3, QualityTier.LOW, GapStatus.ACTIVE, null)
                .violate(setupDate.plusDays(6));

        SymbolState state = new SymbolState("MSFT");
        state.addSetup(setup);
        state.addGap(broken);
        state.addGap(violated);
        BreakoutOutcome outcome = BreakoutOutcome.breakout(LocalDate.of(2024, 3, 12), 110.0, 105.0, 6);
        state.addSignal(Signal.fromBreakout(setup, broken, outcome));
        state.replaceSetup(setup.consume());
        state.replaceGap(broken.consume());
        state.setLastAnalyzedDate(LocalDate.of(2024, 3, 15));
        state.setLastUpdated(Instant.parse("2024-03-15T21:00:00Z"));
        return state;
    }
}
