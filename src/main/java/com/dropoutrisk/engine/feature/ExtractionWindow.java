package com.dropoutrisk.engine.feature;

import java.time.LocalDate;

/**
 * Inclusive date range for attendance and exam records. A null bound is open.
 */
public record ExtractionWindow(LocalDate from, LocalDate to) {

    private static final ExtractionWindow UNBOUNDED = new ExtractionWindow(null, null);

    public ExtractionWindow {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("Window start " + from + " is after end " + to);
        }
    }

    public static ExtractionWindow unbounded() {
        return UNBOUNDED;
    }

    public boolean contains(LocalDate date) {
        return (from == null || !date.isBefore(from)) && (to == null || !date.isAfter(to));
    }
}
