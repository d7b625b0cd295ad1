package com.hwbscan.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Deterministic entity ids. Re-detecting the same pattern yields the same id.
 */
public final class EntityIds {
    private static final DateTimeFormatter COMPACT = DateTimeFormatter.BASIC_ISO_DATE;

    private EntityIds() {
    }

    public static String setupId(LocalDate setupDate) {
        return "setup_" + COMPACT.format(setupDate);
    }

    public static String gapId(LocalDate formationDate, LocalDate setupDate) {
        return "fvg_" + COMPACT.format(formationDate) + "_" + COMPACT.format(setupDate);
    }

    public static String signalId(LocalDate breakoutDate, LocalDate setupDate) {
        return "signal_" + COMPACT.format(breakoutDate) + "_" + COMPACT.format(setupDate);
    }
}
