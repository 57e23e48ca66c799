package com.timeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Calendar range assigned to one phase, both ends inclusive.
 * An empty segment has {@code endDate == startDate - 1}.
 */
public record PhaseSegment(Phase phase, LocalDate startDate, LocalDate endDate) {

    public PhaseSegment {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        if (endDate.isBefore(startDate.minusDays(1))) {
            throw new IllegalArgumentException(
                    phase + " segment ends " + endDate + " more than a day before it starts " + startDate);
        }
    }

    @JsonIgnore
    public boolean isEmpty() {
        return endDate.isBefore(startDate);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public long lengthInDays() {
        return ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    public PhaseSegment withStartDate(LocalDate newStart) {
        return new PhaseSegment(phase, newStart, endDate);
    }

    public PhaseSegment withEndDate(LocalDate newEnd) {
        return new PhaseSegment(phase, startDate, newEnd);
    }
}
