package com.timeline.model;

import com.timeline.exception.InvalidAnchorDateException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Anchor dates as the host hands them over: ISO strings, possibly blank or malformed.
 * Each anchor is parsed on access so one bad field only affects rules that use it.
 */
public record ProjectTimeline(
        String koDate,
        String fieldworkStart,
        String fieldworkEnd,
        String reportDue
) implements AnchorLookup {

    @Override
    public LocalDate anchor(AnchorKind kind) {
        String raw = switch (kind) {
            case KO_DATE -> koDate;
            case FIELDWORK_START -> fieldworkStart;
            case FIELDWORK_END -> fieldworkEnd;
            case REPORT_DUE -> reportDue;
        };
        if (raw == null || raw.isBlank()) {
            throw new InvalidAnchorDateException("Anchor " + kind.fieldName() + " is not set");
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidAnchorDateException(
                    "Anchor " + kind.fieldName() + " is not a YYYY-MM-DD date: '" + raw + "'", e);
        }
    }

    /**
     * Parse all four anchors.
     *
     * @throws InvalidAnchorDateException on the first missing or malformed anchor
     */
    public AnchorDates toAnchorDates() {
        return new AnchorDates(
                anchor(AnchorKind.KO_DATE),
                anchor(AnchorKind.FIELDWORK_START),
                anchor(AnchorKind.FIELDWORK_END),
                anchor(AnchorKind.REPORT_DUE));
    }

    public static ProjectTimeline from(AnchorDates anchors) {
        return new ProjectTimeline(
                anchors.koDate().toString(),
                anchors.fieldworkStart().toString(),
                anchors.fieldworkEnd().toString(),
                anchors.reportDue().toString());
    }
}
