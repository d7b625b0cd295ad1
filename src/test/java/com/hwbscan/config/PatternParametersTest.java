package com.hwbscan.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PatternParametersTest {

    @Test
    void defaults_shouldMatchDocumentedThresholds() {
        PatternParameters params = PatternParameters.defaults();

        assertEquals(200, params.maPeriod);
        assertEquals(50, params.maMinPeriods);
        assertEquals(0.2, params.zoneMarginFactor, 1e-12);
        assertEquals(30, params.gapMaxSearchDays);
        assertEquals(0.02, params.violationTolerance, 1e-12);
        assertEquals(4, params.breakoutMinScore);
    }

    @Test
    void fromConfig_shouldApplyOverrides() {
        Config config = Config.fromMap(Path.of("."), Map.of("gap.max_search_days", 10, "breakout.min_score", "5"));

        PatternParameters params = PatternParameters.fromConfig(config);

        assertEquals(10, params.gapMaxSearchDays);
        assertEquals(5, params.breakoutMinScore);
        assertEquals("override", config.sourceOf("gap.max_search_days"));
        assertEquals("default", config.sourceOf("gap.min_score"));
    }

    @Test
    void fromConfig_shouldRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> PatternParameters.fromConfig(Config.fromMap(Path.of("."), Map.of("setup.zone_margin_factor", "abc"))));
        assertThrows(IllegalArgumentException.class,
                () -> PatternParameters.fromConfig(Config.fromMap(Path.of("."), Map.of("indicator.ma_min_periods", "300"))));
        assertThrows(IllegalArgumentException.class,
                () -> PatternParameters.fromConfig(Config.fromMap(Path.of("."), Map.of("breakout.violation_tolerance", "1.5"))));
    }

    @Test
    void scanSettings_shouldRejectNonPositiveWorkers() {
        assertThrows(IllegalArgumentException.class,
                () -> ScanSettings.fromConfig(Config.fromMap(Path.of("."), Map.of("scan.workers", "0"))));
        ScanSettings settings = ScanSettings.fromConfig(Config.fromMap(Path.of("/tmp/hwb"), Map.of()));
        assertEquals(20, settings.batchSize);
        assertEquals(Path.of("/tmp/hwb/data/hwb"), settings.dataDir);
    }
}
