package com.hwbscan.analysis;

import com.hwbscan.cache.PriceHistorySource;
import com.hwbscan.model.BreakoutOutcome;
import com.hwbscan.model.Gap;
import com.hwbscan.model.PriceHistory;
import com.hwbscan.model.PriceSeries;
import com.hwbscan.model.SeriesLookupException;
import com.hwbscan.model.Setup;
import com.hwbscan.model.Signal;
import com.hwbscan.model.SummaryEntry;
import com.hwbscan.model.SummaryKind;
import com.hwbscan.model.SymbolState;
import com.hwbscan.pattern.PatternEngine;
import com.hwbscan.state.SymbolStateStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Runs the pattern rules against one symbol. The first encounter scans the full
 * history; later runs only look at bars after {@code last_analyzed_date} and at
 * entities that are still active.
 */
public final class DifferentialAnalyzer implements SymbolAnalyzer {
    private static final Logger LOG = LogManager.getLogger(DifferentialAnalyzer.class);

    private final PriceHistorySource prices;
    private final SymbolStateStore store;
    private final PatternEngine engine;
    private final SummaryScorer scorer;
    private final Clock clock;
    private final int lookbackYears;

    public DifferentialAnalyzer(
            PriceHistorySource prices,
            SymbolStateStore store,
            PatternEngine engine,
            Clock clock,
            int lookbackYears
    ) {
        this.prices = prices;
        this.store = store;
        this.engine = engine;
        this.scorer = new SummaryScorer();
        this.clock = clock;
        this.lookbackYears = lookbackYears;
    }

    @Override
    public SymbolAnalysisResult analyze(String symbol) throws IOException, SQLException {
        Optional<PriceHistory> history = prices.getSeries(symbol, lookbackYears);
        if (history.isEmpty() || history.get().daily.isEmpty()) {
            return SymbolAnalysisResult.noData(symbol);
        }
        PriceSeries daily = history.get().daily;
        PriceSeries weekly = history.get().weekly;

        Optional<SymbolState> prior = store.load(symbol);
        SymbolState state;
        AnalysisMode mode;
        boolean changed;
        if (prior.isEmpty() || prior.get().getLastAnalyzedDate() == null) {
            state = prior.orElseGet(() -> new SymbolState(symbol));
            mode = AnalysisMode.FULL;
            runFull(state, daily, weekly);
            changed = true;
        } else {
            state = prior.get();
            mode = AnalysisMode.INCREMENTAL;
            changed = runIncremental(state, daily, weekly);
        }

        if (changed) {
            state.setLastAnalyzedDate(daily.last().date);
            state.setLastUpdated(clock.instant());
            store.save(symbol, state);
        }
        LOG.debug("{} analyzed mode={} changed={} setups={} gaps={} signals={}",
                symbol, mode, changed, state.setups().size(), state.gaps().size(), state.signals().size());

        return new SymbolAnalysisResult(
                symbol,
                SymbolOutcome.ANALYZED,
                mode,
                changed,
                signalEntries(state, daily),
                candidateEntries(state)
        );
    }

    void runFull(SymbolState state, PriceSeries daily, PriceSeries weekly) {
        int from = daily.firstIndexWithAverages();
        for (Setup setup : engine.findSetups(daily, weekly, from, daily.lastIndex())) {
            state.addSetup(setup);
        }
        for (Setup setup : state.activeSetups()) {
            processSetup(state, daily, setup, 0, 0);
        }
    }

    boolean runIncremental(SymbolState state, PriceSeries daily, PriceSeries weekly) {
        int deltaStart = daily.firstIndexAfter(state.getLastAnalyzedDate());
        if (deltaStart > daily.lastIndex()) {
            return false;
        }
        boolean changed = false;

        for (Setup setup : state.activeSetups()) {
            OptionalInt setupIdx = daily.indexOf(setup.date);
            if (setupIdx.isEmpty()) {
                LOG.warn("{}: setup {} no longer in series, skipped this run", state.getSymbol(), setup.id);
                continue;
            }
            int resume = setupIdx.getAsInt() + 2;
            Optional<Gap> latest = state.latestGapOf(setup.id);
            if (latest.isPresent()) {
                OptionalInt latestIdx = daily.indexOf(latest.get().formationDate);
                if (latestIdx.isEmpty()) {
                    LOG.warn("{}: gap {} no longer in series, skipped this run", state.getSymbol(), latest.get().id);
                    continue;
                }
                resume = latestIdx.getAsInt() + 1;
            }
            changed |= processSetup(state, daily, setup, Math.max(deltaStart, resume), deltaStart);
        }

        if (state.activeSetups().isEmpty()) {
            int recentFrom = Math.max(deltaStart, daily.lastIndex() - engine.parameters().setupRecentBars + 1);
            int from = Math.max(recentFrom, daily.firstIndexWithAverages());
            for (Setup setup : engine.findSetups(daily, weekly, from, daily.lastIndex())) {
                if (state.addSetup(setup)) {
                    changed = true;
                    processSetup(state, daily, setup, 0, 0);
                }
            }
        }
        return changed;
    }

    /**
     * Finds new gaps for {@code setup} from {@code gapFromIndex}, then checks its active
     * gaps in score order for a breakout from {@code scanFromIndex}. Stops at the first
     * breakout, which consumes the setup and every sibling gap still active.
     */
    private boolean processSetup(SymbolState state, PriceSeries daily, Setup setup, int gapFromIndex, int scanFromIndex) {
        boolean changed = false;
        try {
            for (Gap gap : engine.findGaps(daily, setup, gapFromIndex, Integer.MAX_VALUE)) {
                changed |= state.addGap(gap);
            }
        } catch (SeriesLookupException e) {
            LOG.warn("{}: gap search skipped for {}: {}", state.getSymbol(), setup.id, e.getMessage());
            return changed;
        }

        List<Gap> candidates = new ArrayList<>();
        for (Gap gap : state.gapsOf(setup.id)) {
            if (gap.isActive()) {
                candidates.add(gap);
            }
        }
        candidates.sort(Comparator.comparingInt((Gap g) -> g.score).reversed()
                .thenComparing(g -> g.formationDate));

        for (Gap gap : candidates) {
            BreakoutOutcome outcome;
            try {
                outcome = engine.evaluateBreakout(daily, setup, gap, scanFromIndex);
            } catch (SeriesLookupException e) {
                LOG.warn("{}: breakout check skipped for {}: {}", state.getSymbol(), gap.id, e.getMessage());
                continue;
            }
            if (outcome.isViolated()) {
                state.replaceGap(gap.violate(outcome.date));
                changed = true;
            } else if (outcome.isBreakout()) {
                Setup owner = state.findSetup(setup.id).orElse(setup);
                state.addSignal(Signal.fromBreakout(owner, gap, outcome));
                state.replaceSetup(owner.consume());
                for (Gap sibling : state.gapsOf(setup.id)) {
                    if (sibling.isActive()) {
                        state.replaceGap(sibling.consume());
                    }
                }
                return true;
            }
        }
        return changed;
    }

    private List<SummaryEntry> signalEntries(SymbolState state, PriceSeries daily) {
        List<SummaryEntry> out = new ArrayList<>();
        int recentFrom = Math.max(0, daily.lastIndex() - engine.parameters().signalRecentBars + 1);
        LocalDate cutoff = daily.get(recentFrom).date;
        for (Signal signal : state.signals()) {
            if (signal.breakoutDate.isBefore(cutoff)) {
                continue;
            }
            Optional<Setup> setup = state.findSetup(signal.setupId);
            Optional<Gap> gap = state.findGap(signal.fvgId);
            if (setup.isEmpty() || gap.isEmpty()) {
                continue;
            }
            out.add(new SummaryEntry(
                    state.getSymbol(),
                    SummaryKind.SIGNAL,
                    signal.breakoutDate,
                    scorer.score(setup.get(), gap.get(), signal),
                    signal.setupId,
                    signal.fvgId,
                    signal.id,
                    signal.confidence
            ));
        }
        return out;
    }

    private List<SummaryEntry> candidateEntries(SymbolState state) {
        List<SummaryEntry> out = new ArrayList<>();
        for (Gap gap : state.activeGaps()) {
            Optional<Setup> setup = state.findSetup(gap.setupId);
            if (setup.isEmpty()) {
                continue;
            }
            out.add(new SummaryEntry(
                    state.getSymbol(),
                    SummaryKind.CANDIDATE,
                    gap.formationDate,
                    scorer.score(setup.get(), gap, null),
                    gap.setupId,
                    gap.id,
                    null,
                    gap.quality
            ));
        }
        return out;
    }
}
