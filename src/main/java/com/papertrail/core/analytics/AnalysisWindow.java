package com.papertrail.core.analytics;

import java.time.LocalDate;

/**
 * Inclusive award-date window. Either bound may be null for an open end.
 */
public record AnalysisWindow(LocalDate from, LocalDate to) {

    public AnalysisWindow {
        if (from != null && to != null && to.isBefore(from)) {
            throw new IllegalArgumentException("Window ends before it starts: " + from + " > " + to);
        }
    }

    public static AnalysisWindow unbounded() {
        return new AnalysisWindow(null, null);
    }

    public boolean contains(LocalDate date) {
        return (from == null || !date.isBefore(from)) && (to == null || !date.isAfter(to));
    }
}
