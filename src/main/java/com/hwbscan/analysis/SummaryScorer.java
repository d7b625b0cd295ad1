package com.hwbscan.analysis;

import com.hwbscan.model.Gap;
import com.hwbscan.model.Setup;
import com.hwbscan.model.Signal;

/**
 * 0..100 ranking score: up to 30 for a tight setup zone, up to 40 for gap size
 * and up to 30 for breakout strength.
 */
public final class SummaryScorer {

    public int score(Setup setup, Gap gap, Signal signal) {
        double score = 0.0;
        double mid = setup.zoneMidpoint();
        if (mid > 0) {
            double zoneWidthPct = (setup.zoneUpper - setup.zoneLower) / mid;
            score += Math.max(0.0, 30.0 - zoneWidthPct * 2000.0);
        }
        score += Math.min(40.0, Math.max(0.0, gap.gapPercentage) * 50.0);
        if (signal != null) {
            score += Math.min(30.0, Math.max(0.0, signal.breakoutPercentage) * 20.0);
        }
        return (int) Math.min(score, 100.0);
    }
}
