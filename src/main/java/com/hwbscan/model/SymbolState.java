package com.hwbscan.model;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-symbol pattern memory: setups, gaps and signals in insertion order.
 * Entities are keyed by id, so re-adding a known id is a no-op.
 */
public final class SymbolState {
    @Getter
    private final String symbol;
    @Getter
    @Setter
    private LocalDate lastAnalyzedDate;
    @Getter
    @Setter
    private Instant lastUpdated;

    private final Map<String, Setup> setups = new LinkedHashMap<>();
    private final Map<String, Gap> gaps = new LinkedHashMap<>();
    private final Map<String, Signal> signals = new LinkedHashMap<>();

    public SymbolState(String symbol) {
        if (symbol == null || symbol.trim().isEmpty()) {
            throw new IllegalArgumentException("symbol must not be empty");
        }
        this.symbol = symbol.trim();
    }

    public List<Setup> setups() {
        return Collections.unmodifiableList(new ArrayList<>(setups.values()));
    }

    public List<Gap> gaps() {
        return Collections.unmodifiableList(new ArrayList<>(gaps.values()));
    }

    public List<Signal> signals() {
        return Collections.unmodifiableList(new ArrayList<>(signals.values()));
    }

    public boolean addSetup(Setup setup) {
        return setups.putIfAbsent(setup.id, setup) == null;
    }

    public boolean addGap(Gap gap) {
        if (!setups.containsKey(gap.setupId)) {
            throw new IllegalArgumentException("unknown setup for gap " + gap.id + ": " + gap.setupId);
        }
        return gaps.putIfAbsent(gap.id, gap) == null;
    }

    public boolean addSignal(Signal signal) {
        return signals.putIfAbsent(signal.id, signal) == null;
    }

    public void replaceSetup(Setup setup) {
        if (!setups.containsKey(setup.id)) {
            throw new IllegalArgumentException("unknown setup: " + setup.id);
        }
        setups.put(setup.id, setup);
    }

    public void replaceGap(Gap gap) {
        if (!gaps.containsKey(gap.id)) {
            throw new IllegalArgumentException("unknown gap: " + gap.id);
        }
        gaps.put(gap.id, gap);
    }

    public Optional<Setup> findSetup(String id) {
        return Optional.ofNullable(setups.get(id));
    }

    public Optional<Gap> findGap(String id) {
        return Optional.ofNullable(gaps.get(id));
    }

    public List<Setup> activeSetups() {
        List<Setup> out = new ArrayList<>();
        for (Setup setup : setups.values()) {
            if (setup.isActive()) {
                out.add(setup);
            }
        }
        return out;
    }

    public List<Gap> gapsOf(String setupId) {
        List<Gap> out = new ArrayList<>();
        for (Gap gap : gaps.values()) {
            if (gap.setupId.equals(setupId)) {
                out.add(gap);
            }
        }
        return out;
    }

    public List<Gap> activeGaps() {
        List<Gap> out = new ArrayList<>();
        for (Gap gap : gaps.values()) {
            if (gap.isActive()) {
                out.add(gap);
            }
        }
        return out;
    }

    public Optional<Gap> latestGapOf(String setupId) {
        Gap latest = null;
        for (Gap gap : gaps.values()) {
            if (!gap.setupId.equals(setupId)) {
                continue;
            }
            if (latest == null || gap.formationDate.isAfter(latest.formationDate)) {
                latest = gap;
            }
        }
        return Optional.ofNullable(latest);
    }
}
