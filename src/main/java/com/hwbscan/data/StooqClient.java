package com.hwbscan.data;

import com.hwbscan.config.Config;
import com.hwbscan.model.PriceBar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stooq CSV download client with retry, request pacing and a timeout circuit breaker.
 */
public final class StooqClient implements PriceHistoryProvider {
    private static final Logger LOG = LogManager.getLogger(StooqClient.class);
    private static final DateTimeFormatter STOOQ_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final String baseUrl;
    private final String symbolSuffix;
    private final int timeoutSec;
    private final int retryCount;
    private final long retrySleepMs;
    private final long requestPauseMs;
    private final int timeoutStreakThreshold;
    private final long circuitCooldownMs;
    private final HttpClient httpClient;
    private final AtomicLong lastRequestAtNanos = new AtomicLong(0L);
    private final AtomicInteger timeoutStreak = new AtomicInteger(0);
    private final AtomicLong circuitOpenUntilNanos = new AtomicLong(0L);

    public StooqClient(Config config) {
        this.baseUrl = config.getString("stooq.base_url", "https://stooq.com/q/d/l/?s=%s&d1=%s&d2=%s&i=%s");
        this.symbolSuffix = config.getString("stooq.symbol_suffix", "");
        this.timeoutSec = Math.max(3, config.getInt("stooq.request_timeout_sec", 20));
        this.retryCount = Math.max(0, config.getInt("stooq.retry_count", 2));
        this.retrySleepMs = Math.max(100L, config.getLong("stooq.retry_sleep_ms", 700L));
        this.requestPauseMs = Math.max(0L, config.getLong("stooq.request_pause_ms", 0L));
        this.timeoutStreakThreshold = Math.max(1, config.getInt("stooq.circuit_breaker.timeout_streak", 10));
        this.circuitCooldownMs = Math.max(0L, config.getLong("stooq.circuit_breaker.cooldown_sec", 60L) * 1000L);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(timeoutSec))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public List<PriceBar> fetchHistory(String symbol, LocalDate start, LocalDate end, BarInterval interval) throws FetchException {
        String providerSymbol = toProviderSymbol(symbol);
        if (providerSymbol.isEmpty()) {
            return List.of();
        }
        if (start != null && end != null && start.isAfter(end)) {
            return List.of();
        }
        String url = String.format(
                baseUrl,
                providerSymbol,
                start == null ? "" : STOOQ_DATE.format(start),
                end == null ? "" : STOOQ_DATE.format(end),
                interval.code()
        );
        String lastError = "";
        String lastCategory = "other";
        for (int attempt = 0; attempt <= retryCount; attempt++) {
            try {
                waitIfCircuitOpen();
                throttleRequest(requestPauseMs);
                HttpRequest request = HttpRequest.newBuilder()
                        .uri(URI.create(url))
                        .header("User-Agent", "hwb-scan/1.0")
                        .timeout(Duration.ofSeconds(timeoutSec))
                        .GET()
                        .build();
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() / 100 != 2) {
                    throw new IOException("stooq http status=" + response.statusCode() + " symbol=" + symbol);
                }
                List<PriceBar> bars = parseCsv(response.body(), interval);
                onRequestResult(true, "");
                return bars;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException("stooq_fetch_interrupted symbol=" + symbol, "other", attempt + 1, e);
            } catch (IOException | IllegalStateException e) {
                lastError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                lastCategory = classifyFailureMessage(lastError);
                onRequestResult(false, lastCategory);
                if (attempt >= retryCount || !isRetryable(lastError)) {
                    break;
                }
                try {
                    Thread.sleep(retrySleepMs * (attempt + 1));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new FetchException("stooq_fetch_interrupted symbol=" + symbol, "other", attempt + 1, ie);
                }
            }
        }
        if (lastError.trim().isEmpty()) {
            lastError = "stooq_fetch_failed";
        }
        throw new FetchException(lastError, lastCategory, retryCount + 1);
    }

    String toProviderSymbol(String symbol) {
        String normalized = symbol == null ? "" : symbol.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return "";
        }
        if (normalized.contains(".") || symbolSuffix.isEmpty()) {
            return normalized;
        }
        return normalized + symbolSuffix.toLowerCase(Locale.ROOT);
    }

    private void onRequestResult(boolean success, String failureCategory) {
        if (success) {
            timeoutStreak.set(0);
            return;
        }
        if (!"timeout".equals(failureCategory)) {
            timeoutStreak.set(0);
            return;
        }
        int streak = timeoutStreak.incrementAndGet();
        if (streak < timeoutStreakThreshold || circuitCooldownMs <= 0L) {
            return;
        }
        timeoutStreak.set(0);
        openCircuitCooldown();
    }

    private void openCircuitCooldown() {
        long now = System.nanoTime();
        long openUntil = now + TimeUnit.MILLISECONDS.toNanos(circuitCooldownMs);
        while (true) {
            long prev = circuitOpenUntilNanos.get();
            long next = Math.max(prev, openUntil);
            if (circuitOpenUntilNanos.compareAndSet(prev, next)) {
                if (next > prev) {
                    LOG.warn(String.format(
                            Locale.US,
                            "Stooq circuit breaker open: timeout_streak=%d cooldown=%ds",
                            timeoutStreakThreshold,
                            Math.max(1L, circuitCooldownMs / 1000L)
                    ));
                }
                return;
            }
        }
    }

    private void waitIfCircuitOpen() throws InterruptedException {
        while (true) {
            long until = circuitOpenUntilNanos.get();
            long now = System.nanoTime();
            if (until <= now) {
                return;
            }
            TimeUnit.NANOSECONDS.sleep(until - now);
        }
    }

    public static String classifyFailureMessage(String message) {
        String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (msg.contains("timed out") || msg.contains("timeout") || msg.contains("connection reset")) {
            return "timeout";
        }
        if (msg.contains("stooq_rate_limit")
                || msg.contains("daily hits limit")
                || msg.contains("http status=429")) {
            return "rate_limit";
        }
        if (msg.contains("no data") || msg.contains("no_data") || msg.contains("http status=404")) {
            return "no_data";
        }
        if (msg.contains("unexpected_stooq_payload")) {
            return "parse_error";
        }
        return "other";
    }

    private void throttleRequest(long pauseMs) throws InterruptedException {
        if (pauseMs <= 0L) {
            return;
        }
        long pauseNanos = pauseMs * 1_000_000L;
        while (true) {
            long prev = lastRequestAtNanos.get();
            long now = System.nanoTime();
            long nextAllowed = prev + pauseNanos;
            if (now < nextAllowed) {
                TimeUnit.NANOSECONDS.sleep(nextAllowed - now);
                continue;
            }
            if (lastRequestAtNanos.compareAndSet(prev, now)) {
                return;
            }
        }
    }

    private boolean isRetryable(String message) {
        String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (msg.contains("timed out") || msg.contains("timeout") || msg.contains("connection reset")) {
            return true;
        }
        return msg.contains("http status=429") || msg.contains("http status=500") || msg.contains("http status=502")
                || msg.contains("http status=503") || msg.contains("http status=504");
    }

    /**
     * Parses a Stooq CSV body. Weekly rows are re-dated to the Monday of their week.
     */
    static List<PriceBar> parseCsv(String body, BarInterval interval) {
        if (body == null) {
            return List.of();
        }
        String text = body.trim();
        if (text.isEmpty() || text.equalsIgnoreCase("No data")) {
            return List.of();
        }
        if (text.toLowerCase(Locale.ROOT).contains("exceeded the daily hits limit")) {
            throw new IllegalStateException("stooq_rate_limit");
        }

        String[] lines = text.split("\\r?\\n");
        String header = lines[0].trim().toLowerCase(Locale.ROOT);
        if (!header.startsWith("date,open,high,low,close")) {
            String sample = text.length() > 120 ? text.substring(0, 120) : text;
            throw new IllegalStateException("unexpected_stooq_payload:" + sample);
        }

        List<PriceBar> all = new ArrayList<>(Math.max(64, lines.length));
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] cols = line.split(",");
            if (cols.length < 5) {
                continue;
            }
            try {
                LocalDate date = LocalDate.parse(cols[0].trim());
                if (interval == BarInterval.WEEKLY) {
                    date = date.with(DayOfWeek.MONDAY);
                }
                double open = parseDouble(cols[1]);
                double high = parseDouble(cols[2]);
                double low = parseDouble(cols[3]);
                double close = parseDouble(cols[4]);
                long volume = cols.length >= 6 ? Math.round(parseDouble(cols[5])) : 0L;
                if (close <= 0) {
                    continue;
                }
                all.add(new PriceBar(date, open, high, low, close, volume));
            } catch (DateTimeParseException | NumberFormatException e) {
                LOG.debug("skip malformed stooq line {}: {}", i, line);
            }
        }
        all.sort(Comparator.comparing(bar -> bar.date));
        return all;
    }

    private static double parseDouble(String input) {
        String v = input == null ? "" : input.trim();
        if (v.isEmpty() || v.equalsIgnoreCase("null")) {
            return 0.0;
        }
        return Double.parseDouble(v);
    }
}
