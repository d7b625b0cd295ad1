package com.hwbscan.app;

import com.hwbscan.analysis.DifferentialAnalyzer;
import com.hwbscan.analysis.SymbolAnalysisResult;
import com.hwbscan.cache.PriceCache;
import com.hwbscan.config.Config;
import com.hwbscan.config.PatternParameters;
import com.hwbscan.config.ScanSettings;
import com.hwbscan.data.StooqClient;
import com.hwbscan.db.Database;
import com.hwbscan.db.MigrationRunner;
import com.hwbscan.db.PriceCacheDao;
import com.hwbscan.indicator.IndicatorEngine;
import com.hwbscan.model.DailySummary;
import com.hwbscan.model.SymbolState;
import com.hwbscan.pattern.PatternEngine;
import com.hwbscan.runner.BatchScanner;
import com.hwbscan.runner.DailySummaryWriter;
import com.hwbscan.runner.ScanWorkerPool;
import com.hwbscan.state.JsonFileSymbolStateStore;
import com.hwbscan.state.SymbolStateJson;
import com.hwbscan.universe.UniverseLoader;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 模块说明：HwbScanApplication（class）。
 * 主要职责：解析命令行，装配缓存、规则引擎、状态存储与批量扫描器，并执行扫描或单只分析。
 * 使用建议：退出码 0 表示成功，1 表示运行期致命错误，2 表示参数或配置错误。
 */
public final class HwbScanApplication {
    static final String LOG_DIR_PROPERTY = "hwbscan.log.dir";
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new HwbScanApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("hwb-scan", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("hwb-scan", options);
            return 0;
        }
        if (cmd.hasOption("scan") && cmd.hasOption("symbol")) {
            System.err.println("ERROR: --scan and --symbol are mutually exclusive.");
            return 2;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.load(workingDir);
        installLogRoutingIfNeeded(config);

        PatternParameters params;
        ScanSettings settings;
        int limit;
        try {
            params = PatternParameters.fromConfig(config);
            settings = ScanSettings.fromConfig(config);
            limit = parseLimit(cmd.getOptionValue("limit"), settings.maxUniverseSize);
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: invalid configuration: " + e.getMessage());
            return 2;
        }

        try {
            Database database = new Database(
                    config.getString("db.url"),
                    config.getString("db.user"),
                    config.getString("db.pass"),
                    config.getString("db.schema", "public")
            );
            System.out.println("DB type=" + database.dbType()
                    + ", url=" + database.maskedJdbcUrl()
                    + ", schema=" + database.schema());
            new MigrationRunner().run(database);

            Clock clock = Clock.systemDefaultZone();
            PriceCache cache = new PriceCache(
                    new PriceCacheDao(database),
                    new StooqClient(config),
                    new IndicatorEngine(params),
                    clock
            );
            JsonFileSymbolStateStore store = new JsonFileSymbolStateStore(settings.dataDir.resolve("symbols"));
            DifferentialAnalyzer analyzer = new DifferentialAnalyzer(
                    cache,
                    store,
                    new PatternEngine(params),
                    clock,
                    settings.lookbackYears
            );

            if (cmd.hasOption("symbol")) {
                return runSingle(cmd.getOptionValue("symbol"), analyzer, store);
            }

            Path universePath = cmd.hasOption("universe")
                    ? workingDir.resolve(cmd.getOptionValue("universe")).normalize()
                    : null;
            List<String> universe;
            try {
                universe = new UniverseLoader(config).load(universePath, limit);
            } catch (IllegalArgumentException e) {
                System.err.println("ERROR: invalid universe: " + e.getMessage());
                return 2;
            }
            return runScan(universe, analyzer, settings, clock);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("FATAL: scan interrupted");
            return 1;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private int runScan(List<String> universe, DifferentialAnalyzer analyzer, ScanSettings settings, Clock clock)
            throws InterruptedException, IOException {
        DailySummary summary;
        try (ScanWorkerPool pool = new ScanWorkerPool(settings.workers)) {
            BatchScanner scanner = new BatchScanner(analyzer, pool, settings, clock);
            summary = scanner.scan(universe);
        }
        Path written = new DailySummaryWriter(settings.dataDir.resolve("daily")).write(summary);
        System.out.println(String.format(
                Locale.US,
                "Scan complete. signals=%d candidates=%d failed=%d summary=%s",
                summary.signals.size(),
                summary.candidates.size(),
                summary.failedCount,
                written.toAbsolutePath()
        ));
        return 0;
    }

    private int runSingle(String rawSymbol, DifferentialAnalyzer analyzer, JsonFileSymbolStateStore store) throws Exception {
        String symbol = rawSymbol == null ? "" : rawSymbol.trim().toUpperCase(Locale.ROOT);
        if (symbol.isEmpty()) {
            System.err.println("ERROR: --symbol requires a value.");
            return 2;
        }
        SymbolAnalysisResult result = analyzer.analyze(symbol);
        System.out.println(symbol + " outcome=" + result.outcome
                + ", mode=" + result.mode
                + ", changed=" + result.changed
                + ", signals=" + result.signals.size()
                + ", candidates=" + result.candidates.size());
        Optional<SymbolState> state = store.load(symbol);
        if (state.isEmpty()) {
            System.out.println("No data for " + symbol);
            return 0;
        }
        System.out.println(SymbolStateJson.toJson(state.get()).toString(2));
        return 0;
    }

    static int parseLimit(String raw, int configured) {
        if (raw == null || raw.trim().isEmpty()) {
            return configured;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 0) {
                throw new IllegalArgumentException("--limit must be >= 0, got " + value);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--limit must be an integer, got " + raw, e);
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (HwbScanApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = configureLogDirectory(config);

                // Log4j has to be running before the swap so the console appender keeps the real streams.
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (IOException | SecurityException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    /**
     * Points the rolling file appender at {@code <data.dir>/log}. Reading the config
     * already started Log4j with the fallback directory, so the context is reloaded.
     */
    static Path configureLogDirectory(Config config) throws IOException {
        Path logDir = config.getPath("data.dir").resolve("log");
        Files.createDirectories(logDir);
        System.setProperty(LOG_DIR_PROPERTY, logDir.toAbsolutePath().toString());
        Configurator.reconfigure();
        return logDir;
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("scan").desc("scan the whole universe and write the daily summary (default)").build());
        options.addOption(Option.builder().longOpt("symbol").hasArg().argName("SYM").desc("analyze one symbol and print its state document").build());
        options.addOption(Option.builder().longOpt("universe").hasArg().argName("path").desc("universe file, one symbol per line").build());
        options.addOption(Option.builder().longOpt("limit").hasArg().argName("n").desc("scan only the first n symbols").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
