package com.hwbscan.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：按 默认值 → classpath config.properties → 工作目录 config.properties 的顺序合并配置。
 * 使用建议：只在启动时读取一次，再转换成不可变的参数对象传给各模块。
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);
    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

/**
 * 方法说明：load，负责加载配置或数据。
 * 处理流程：先读取 classpath 中的 config.properties，再用工作目录下的同名文件覆盖。
 * 维护提示：读取失败只记录警告，缺省值仍然生效。
 */
    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            LOG.warn("failed to read classpath config.properties: {}", e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                LOG.warn("failed to read {}: {}", local, e.getMessage());
            }
        }

        return config;
    }

    /**
     * Builds a Config from explicit key/value pairs layered over the defaults.
     */
    public static Config fromMap(Path workingDir, Map<String, ?> values) {
        Config config = new Config(workingDir);
        if (values != null) {
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    continue;
                }
                config.overrideProps.setProperty(entry.getKey(), String.valueOf(entry.getValue()));
            }
            config.props.putAll(config.overrideProps);
        }
        return config;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

/**
 * 方法说明：getPath，负责获取数据并返回结果。
 * 处理流程：相对路径按工作目录解析；空值返回工作目录本身。
 */
    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    /**
     * Strict numeric read: a present but unparsable value is a configuration error.
     */
    public double requireDouble(String key) {
        String value = requireString(key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid number for config " + key + ": " + value, e);
        }
    }

    public int requireInt(String key) {
        String value = requireString(key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid integer for config " + key + ": " + value, e);
        }
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static int parseInt(String value, int fallback) {
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("data.dir", "data/hwb");
        defaults.put("db.url", "jdbc:sqlite:data/hwb/hwb_cache.db");
        defaults.put("db.user", "");
        defaults.put("db.pass", "");
        defaults.put("db.schema", "public");

        defaults.put("universe.path", "universe.txt");
        defaults.put("universe.symbols", "");

        defaults.put("cache.lookback_years", "10");

        defaults.put("scan.batch_size", "20");
        defaults.put("scan.workers", "5");
        defaults.put("scan.batch_pause_ms", "100");
        defaults.put("scan.progress.log_every", "100");
        defaults.put("scan.max_universe_size", "0");

        defaults.put("stooq.base_url", "https://stooq.com/q/d/l/?s=%s&d1=%s&d2=%s&i=%s");
        defaults.put("stooq.symbol_suffix", ".us");
        defaults.put("stooq.request_timeout_sec", "20");
        defaults.put("stooq.retry_count", "2");
        defaults.put("stooq.retry_sleep_ms", "700");
        defaults.put("stooq.request_pause_ms", "0");
        defaults.put("stooq.circuit_breaker.timeout_streak", "10");
        defaults.put("stooq.circuit_breaker.cooldown_sec", "60");

        defaults.put("indicator.ma_period", "200");
        defaults.put("indicator.ma_min_periods", "50");

        defaults.put("trend.min_weekly_distance", "0.001");

        defaults.put("setup.zone_margin_factor", "0.2");
        defaults.put("setup.atr_weight", "0.5");
        defaults.put("setup.primary_confidence", "0.85");
        defaults.put("setup.secondary_confidence", "0.65");
        defaults.put("setup.recent_bars", "5");

        defaults.put("gap.max_search_days", "30");
        defaults.put("gap.min_gap_pct", "0.001");
        defaults.put("gap.min_score", "3");
        defaults.put("gap.size_tier_high_pct", "0.02");
        defaults.put("gap.size_tier_mid_pct", "0.01");
        defaults.put("gap.volume_surge_strong", "2.0");
        defaults.put("gap.volume_surge_weak", "1.5");
        defaults.put("gap.proximity_base", "0.05");
        defaults.put("gap.proximity_cap", "0.10");

        defaults.put("breakout.resistance_lookback", "20");
        defaults.put("breakout.base_threshold", "0.001");
        defaults.put("breakout.threshold_cap", "0.03");
        defaults.put("breakout.violation_tolerance", "0.02");
        defaults.put("breakout.volume_confirm_ratio", "1.2");
        defaults.put("breakout.momentum_bars", "5");
        defaults.put("breakout.min_score", "4");

        defaults.put("volatility.window", "20");
        defaults.put("summary.signal_recent_bars", "5");

        return Collections.unmodifiableMap(defaults);
    }
}
