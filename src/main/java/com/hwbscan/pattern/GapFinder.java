package com.hwbscan.pattern;

import com.hwbscan.config.PatternParameters;
import com.hwbscan.indicator.IndicatorEngine;
import com.hwbscan.model.EntityIds;
import com.hwbscan.model.Gap;
import com.hwbscan.model.GapStatus;
import com.hwbscan.model.PriceBar;
import com.hwbscan.model.PriceSeries;
import com.hwbscan.model.QualityTier;
import com.hwbscan.model.Setup;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Three-bar fair value gap detection after a setup: candle3's low above candle1's high.
 */
public final class GapFinder {
    static final int VOLUME_AVERAGE_BARS = 20;

    private final PatternParameters params;
    private final IndicatorEngine indicators;

    public GapFinder(PatternParameters params, IndicatorEngine indicators) {
        this.params = params;
        this.indicators = indicators;
    }

    public List<Gap> find(PriceSeries daily, Setup setup) {
        return find(daily, setup, 0, Integer.MAX_VALUE);
    }

    /**
     * Searches the setup's window {@code [setup+2, setup+maxSearchDays]} clipped to
     * {@code fromIndex..toIndex}. Result is ordered by score, best first.
     *
     * @throws com.hwbscan.model.SeriesLookupException when the setup date is not in the series
     */
    public List<Gap> find(PriceSeries daily, Setup setup, int fromIndex, int toIndex) {
        int setupIdx = daily.requireIndex(setup.date);
        int start = Math.max(setupIdx + 2, fromIndex);
        int end = Math.min(Math.min(setupIdx + params.gapMaxSearchDays, daily.lastIndex()), toIndex);

        List<Gap> out = new ArrayList<>();
        for (int i = start; i <= end; i++) {
            PriceBar c1 = daily.get(i - 2);
            PriceBar c3 = daily.get(i);
            if (!(c3.low > c1.high) || c1.high <= 0) {
                continue;
            }
            double gapPct = (c3.low - c1.high) / c1.high;
            if (gapPct < params.minGapPct) {
                continue;
            }
            int score = sizePoints(gapPct) + volumePoints(daily, i) + proximityPoints(daily, i, c1, c3);
            if (score < params.gapMinScore) {
                continue;
            }
            out.add(new Gap(
                    EntityIds.gapId(c3.date, setup.date),
                    setup.id,
                    c3.date,
                    c1.high,
                    c3.low,
                    gapPct * 100.0,
                    score,
                    QualityTier.forGapScore(score),
                    GapStatus.ACTIVE,
                    null
            ));
        }
        out.sort(Comparator.comparingInt((Gap g) -> g.score).reversed()
                .thenComparing(g -> g.formationDate));
        return out;
    }

    int sizePoints(double gapPct) {
        if (gapPct >= params.gapSizeTierHighPct) {
            return 3;
        }
        if (gapPct >= params.gapSizeTierMidPct) {
            return 2;
        }
        return 1;
    }

    private int volumePoints(PriceSeries daily, int index) {
        double avg = indicators.averageVolume(daily, index, VOLUME_AVERAGE_BARS);
        if (avg <= 0) {
            return 0;
        }
        double ratio = daily.get(index).volume / avg;
        if (ratio >= params.volumeSurgeStrong) {
            return 2;
        }
        if (ratio >= params.volumeSurgeWeak) {
            return 1;
        }
        return 0;
    }

    private int proximityPoints(PriceSeries daily, int index, PriceBar c1, PriceBar c3) {
        if (c3.sma200 == null && c3.ema200 == null) {
            return 0;
        }
        double mid = (c1.high + c3.low) / 2.0;
        double distance = Double.MAX_VALUE;
        if (c3.sma200 != null && c3.sma200 > 0) {
            distance = Math.min(distance, Math.abs(mid - c3.sma200) / c3.sma200);
        }
        if (c3.ema200 != null && c3.ema200 > 0) {
            distance = Math.min(distance, Math.abs(mid - c3.ema200) / c3.ema200);
        }
        double vol = indicators.returnVolatility(daily, index, params.volatilityWindow);
        double threshold = Math.min(params.proximityBase + vol * 2.0, params.proximityCap);
        if (distance <= threshold / 3.0) {
            return 3;
        }
        if (distance <= threshold * 2.0 / 3.0) {
            return 2;
        }
        if (distance <= threshold) {
            return 1;
        }
        return 0;
    }
}
