package com.timeline.model;

import java.time.LocalDate;

/**
 * Labelled milestone shown on the project calendar, e.g. "Fielding Start".
 */
public record KeyDate(String label, LocalDate date) {

    public KeyDate withDate(LocalDate newDate) {
        return new KeyDate(label, newDate);
    }
}
