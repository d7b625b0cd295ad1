package com.hwbscan.analysis;

import com.hwbscan.model.Gap;
import com.hwbscan.model.GapStatus;
import com.hwbscan.model.QualityTier;
import com.hwbscan.model.Setup;
import com.hwbscan.model.SetupKind;
import com.hwbscan.model.SetupStatus;
import com.hwbscan.model.Signal;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SummaryScorerTest {

    private final SummaryScorer scorer = new SummaryScorer();
    private final LocalDate day = LocalDate.of(2024, 4, 1);

    @Test
    void score_shouldAddZoneGapAndBreakoutParts() {
        // zone 1/128 wide -> 30 - 15.625; gap 0.5% -> 25; breakout 0.5% -> 10
        Setup setup = new Setup("setup_20240401", day, SetupKind.PRIMARY, 0.85, 127.5, 128.5, SetupStatus.ACTIVE);
        Gap gap = gap(0.5);
        Signal signal = new Signal("signal_x", setup.id, gap.id, day.plusDays(5), 130, 129, 6, QualityTier.HIGH, 0.5);

        assertEquals(39, scorer.score(setup, gap, null));
        assertEquals(49, scorer.score(setup, gap, signal));
    }

    @Test
    void score_shouldCapEachPartAndTotal() {
        Setup tight = new Setup("setup_20240401", day, SetupKind.PRIMARY, 0.85, 100.0, 100.0, SetupStatus.ACTIVE);
        Signal strong = new Signal("signal_x", tight.id, "fvg_x", day.plusDays(5), 120, 100, 6, QualityTier.HIGH, 20.0);

        assertEquals(100, scorer.score(tight, gap(5.0), strong));
    }

    private Gap gap(double pct) {
        return new Gap("fvg_x", "setup_20240401", day.plusDays(2), 100, 100 + pct, pct, 4, QualityTier.MEDIUM, GapStatus.ACTIVE, null);
    }
}
