package com.hwbscan.model;

import java.time.LocalDate;

/**
 * A recorded date that is no longer present in a refreshed price series.
 */
public class SeriesLookupException extends RuntimeException {
    private final LocalDate date;

    public SeriesLookupException(LocalDate date) {
        super("date not found in series: " + date);
        this.date = date;
    }

    public LocalDate date() {
        return date;
    }
}
