package com.hwbscan.universe;

import com.hwbscan.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 模块说明：UniverseLoader（class）。
 * 主要职责：从 universe.symbols 或股票池文件读取代码列表，一行一个，# 开头为注释。
 * 使用建议：空代码和重复代码视为配置错误，在扫描开始前抛出 IllegalArgumentException。
 */
public final class UniverseLoader {
    private static final Logger LOG = LogManager.getLogger(UniverseLoader.class);

    private final Config config;

    public UniverseLoader(Config config) {
        this.config = config;
    }

    /**
     * Inline {@code universe.symbols} wins over the file. {@code limit <= 0} means no cap.
     */
    public List<String> load(Path overridePath, int limit) throws IOException {
        List<String> raw;
        String source;
        List<String> inline = config.getList("universe.symbols");
        if (overridePath == null && !inline.isEmpty()) {
            raw = inline;
            source = "config universe.symbols";
        } else {
            Path path = overridePath != null ? overridePath : config.getPath("universe.path");
            if (!Files.exists(path)) {
                throw new IllegalArgumentException("universe file not found: " + path);
            }
            raw = readLines(path);
            source = path.toString();
        }

        List<String> symbols = normalize(raw);
        if (limit > 0 && symbols.size() > limit) {
            symbols = new ArrayList<>(symbols.subList(0, limit));
        }
        LOG.info("universe loaded from {}: {} symbols", source, symbols.size());
        return symbols;
    }

    static List<String> readLines(Path path) throws IOException {
        List<String> out = new ArrayList<>();
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            String trimmed = stripComment(line).trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    static List<String> normalize(List<String> raw) {
        Set<String> seen = new HashSet<>();
        List<String> out = new ArrayList<>(raw.size());
        for (String token : raw) {
            String symbol = token == null ? "" : token.trim().toUpperCase(Locale.ROOT);
            if (symbol.isEmpty()) {
                throw new IllegalArgumentException("blank symbol in universe");
            }
            if (!seen.add(symbol)) {
                throw new IllegalArgumentException("duplicate symbol in universe: " + symbol);
            }
            out.add(symbol);
        }
        return out;
    }

    private static String stripComment(String line) {
        int idx = line.indexOf('#');
        return idx < 0 ? line : line.substring(0, idx);
    }
}
