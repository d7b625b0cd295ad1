package com.hwbscan.cache;

import com.hwbscan.data.BarInterval;
import com.hwbscan.data.FetchException;
import com.hwbscan.data.PriceHistoryProvider;
import com.hwbscan.db.CacheMetadata;
import com.hwbscan.db.CacheWriteException;
import com.hwbscan.db.PriceCacheDao;
import com.hwbscan.indicator.IndicatorEngine;
import com.hwbscan.model.PriceBar;
import com.hwbscan.model.PriceHistory;
import com.hwbscan.model.PriceSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Incremental daily/weekly price cache. Fetches only the delta since the last
 * stored bar, recomputes the averages over the full merged series and replaces
 * the stored series in one transaction.
 */
public final class PriceCache implements PriceHistorySource {
    private static final Logger LOG = LogManager.getLogger(PriceCache.class);

    private final PriceCacheDao dao;
    private final PriceHistoryProvider provider;
    private final IndicatorEngine indicators;
    private final Clock clock;

    public PriceCache(PriceCacheDao dao, PriceHistoryProvider provider, IndicatorEngine indicators, Clock clock) {
        this.dao = dao;
        this.provider = provider;
        this.indicators = indicators;
        this.clock = clock;
    }

    /**
     * Returns the cached history of {@code symbol} after syncing it, or empty when
     * neither the provider nor the cache has any daily bars.
     */
    @Override
    public Optional<PriceHistory> getSeries(String symbol, int lookbackYears) throws SQLException {
        LocalDate today = LocalDate.now(clock);
        Optional<CacheMetadata> meta = dao.loadMetadata(symbol);
        LocalDate fetchStart = resolveFetchStart(meta, today, lookbackYears);

        if (fetchStart != null) {
            try {
                List<PriceBar> daily = provider.fetchHistory(symbol, fetchStart, today, BarInterval.DAILY);
                List<PriceBar> weekly = provider.fetchHistory(
                        symbol,
                        fetchStart.with(DayOfWeek.MONDAY),
                        today,
                        BarInterval.WEEKLY
                );
                if (!daily.isEmpty() || !weekly.isEmpty()) {
                    mergeAndReplace(symbol, meta.isPresent(), daily, weekly);
                } else if (meta.isEmpty()) {
                    LOG.info("no data for {} and no cache, skipping", symbol);
                    return Optional.empty();
                }
            } catch (FetchException e) {
                if (meta.isEmpty()) {
                    LOG.warn("fetch failed for {} with no cache (category={}): {}", symbol, e.category(), e.getMessage());
                    return Optional.empty();
                }
                LOG.warn("fetch failed for {} (category={}, attempts={}), using cached series: {}",
                        symbol, e.category(), e.attempts(), e.getMessage());
            }
        }

        PriceSeries daily = dao.loadDaily(symbol);
        if (daily.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PriceHistory(symbol, daily, dao.loadWeekly(symbol)));
    }

    LocalDate resolveFetchStart(Optional<CacheMetadata> meta, LocalDate today, int lookbackYears) {
        if (meta.isEmpty() || meta.get().lastDate == null) {
            return today.minusDays(365L * Math.max(1, lookbackYears));
        }
        LocalDate last = meta.get().lastDate;
        if (last.isBefore(today)) {
            return last.plusDays(1);
        }
        return null;
    }

    private void mergeAndReplace(
            String symbol,
            boolean cached,
            List<PriceBar> fetchedDaily,
            List<PriceBar> fetchedWeekly
    ) throws CacheWriteException, SQLException {
        PriceSeries storedDaily = cached ? dao.loadDaily(symbol) : PriceSeries.empty();
        PriceSeries storedWeekly = cached ? dao.loadWeekly(symbol) : PriceSeries.empty();

        PriceSeries daily = indicators.withDailyAverages(storedDaily.merge(PriceSeries.of(fetchedDaily)));
        PriceSeries weekly = indicators.withWeeklyAverages(storedWeekly.merge(PriceSeries.of(fetchedWeekly)));

        dao.replaceSeries(symbol, daily, weekly, clock.instant());
        LOG.debug("cache replaced {}: daily={} (+{}), weekly={} (+{})",
                symbol, daily.size(), fetchedDaily.size(), weekly.size(), fetchedWeekly.size());
    }
}
