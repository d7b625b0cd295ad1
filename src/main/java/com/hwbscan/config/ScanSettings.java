package com.hwbscan.config;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ScanSettings {
    public final int batchSize;
    public final int workers;
    public final long batchPauseMs;
    public final int progressLogEvery;
    public final int lookbackYears;
    public final int maxUniverseSize;
    public final Path dataDir;

    public static ScanSettings fromConfig(Config config) {
        ScanSettings settings = ScanSettings.builder()
                .batchSize(config.requireInt("scan.batch_size"))
                .workers(config.requireInt("scan.workers"))
                .batchPauseMs(config.getLong("scan.batch_pause_ms", 100L))
                .progressLogEvery(Math.max(0, config.getInt("scan.progress.log_every", 100)))
                .lookbackYears(config.requireInt("cache.lookback_years"))
                .maxUniverseSize(Math.max(0, config.getInt("scan.max_universe_size", 0)))
                .dataDir(config.getPath("data.dir"))
                .build();
        settings.validate();
        return settings;
    }

    public void validate() {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("scan.batch_size must be > 0, got " + batchSize);
        }
        if (workers <= 0) {
            throw new IllegalArgumentException("scan.workers must be > 0, got " + workers);
        }
        if (batchPauseMs < 0) {
            throw new IllegalArgumentException("scan.batch_pause_ms must be >= 0, got " + batchPauseMs);
        }
        if (lookbackYears <= 0) {
            throw new IllegalArgumentException("cache.lookback_years must be > 0, got " + lookbackYears);
        }
        if (dataDir == null) {
            throw new IllegalArgumentException("missing required config: data.dir");
        }
    }
}
