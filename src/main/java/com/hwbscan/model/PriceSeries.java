package com.hwbscan.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Immutable date-ordered bar list. Construction deduplicates by date, the bar
 * supplied last wins.
 */
public final class PriceSeries {
    private static final PriceSeries EMPTY = new PriceSeries(List.of());

    private final List<PriceBar> bars;
    private final Map<LocalDate, Integer> indexByDate;

    private PriceSeries(List<PriceBar> ordered) {
        this.bars = Collections.unmodifiableList(ordered);
        Map<LocalDate, Integer> idx = new HashMap<>(Math.max(16, ordered.size() * 2));
        for (int i = 0; i < ordered.size(); i++) {
            idx.put(ordered.get(i).date, i);
        }
        this.indexByDate = idx;
    }

    public static PriceSeries empty() {
        return EMPTY;
    }

    public static PriceSeries of(Collection<PriceBar> bars) {
        if (bars == null || bars.isEmpty()) {
            return EMPTY;
        }
        TreeMap<LocalDate, PriceBar> byDate = new TreeMap<>();
        for (PriceBar bar : bars) {
            if (bar != null) {
                byDate.put(bar.date, bar);
            }
        }
        return new PriceSeries(new ArrayList<>(byDate.values()));
    }

    /**
     * Merges {@code newer} into this series; on a shared date the newer bar wins.
     */
    public PriceSeries merge(PriceSeries newer) {
        if (newer == null || newer.isEmpty()) {
            return this;
        }
        List<PriceBar> all = new ArrayList<>(bars.size() + newer.size());
        all.addAll(bars);
        all.addAll(newer.bars);
        return of(all);
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public PriceBar get(int index) {
        return bars.get(index);
    }

    public List<PriceBar> bars() {
        return bars;
    }

    public PriceBar first() {
        return bars.isEmpty() ? null : bars.get(0);
    }

    public PriceBar last() {
        return bars.isEmpty() ? null : bars.get(bars.size() - 1);
    }

    public int lastIndex() {
        return bars.size() - 1;
    }

    public OptionalInt indexOf(LocalDate date) {
        Integer idx = date == null ? null : indexByDate.get(date);
        return idx == null ? OptionalInt.empty() : OptionalInt.of(idx);
    }

    public int requireIndex(LocalDate date) {
        Integer idx = date == null ? null : indexByDate.get(date);
        if (idx == null) {
            throw new SeriesLookupException(date);
        }
        return idx;
    }

    /**
     * Index of the first bar strictly after {@code date}; {@link #size()} when there is none.
     */
    public int firstIndexAfter(LocalDate date) {
        if (date == null) {
            return 0;
        }
        int lo = 0;
        int hi = bars.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (bars.get(mid).date.isAfter(date)) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    /**
     * Index of the last bar dated on or before {@code date}; -1 when there is none.
     */
    public int lastIndexOnOrBefore(LocalDate date) {
        return firstIndexAfter(date) - 1;
    }

    /**
     * First index where both daily averages are defined; {@link #size()} when none is.
     */
    public int firstIndexWithAverages() {
        for (int i = 0; i < bars.size(); i++) {
            if (bars.get(i).hasAverages()) {
                return i;
            }
        }
        return bars.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PriceSeries)) {
            return false;
        }
        return bars.equals(((PriceSeries) o).bars);
    }

    @Override
    public int hashCode() {
        return bars.hashCode();
    }
}
