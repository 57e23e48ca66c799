package com.timeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The four anchor dates of a project.
 *
 * <p>Ordering ({@code koDate <= fieldworkStart <= fieldworkEnd <= reportDue}) is
 * not enforced here; see {@link #violations()}.
 *
 * @param koDate         Project kickoff date
 * @param fieldworkStart First day of fieldwork
 * @param fieldworkEnd   Last day of fieldwork
 * @param reportDue      Final report due date
 */
public record AnchorDates(
        LocalDate koDate,
        LocalDate fieldworkStart,
        LocalDate fieldworkEnd,
        LocalDate reportDue
) implements AnchorLookup {

    public AnchorDates {
        Objects.requireNonNull(koDate, "koDate");
        Objects.requireNonNull(fieldworkStart, "fieldworkStart");
        Objects.requireNonNull(fieldworkEnd, "fieldworkEnd");
        Objects.requireNonNull(reportDue, "reportDue");
    }

    /**
     * Parse ISO {@code YYYY-MM-DD} strings.
     */
    public static AnchorDates of(String koDate, String fieldworkStart, String fieldworkEnd, String reportDue) {
        return new ProjectTimeline(koDate, fieldworkStart, fieldworkEnd, reportDue).toAnchorDates();
    }

    @Override
    public LocalDate anchor(AnchorKind kind) {
        return switch (kind) {
            case KO_DATE -> koDate;
            case FIELDWORK_START -> fieldworkStart;
            case FIELDWORK_END -> fieldworkEnd;
            case REPORT_DUE -> reportDue;
        };
    }

    /**
     * List every ordering violation between consecutive anchors.
     *
     * @return Human-readable violations, empty when the anchors are consistent
     */
    @JsonIgnore
    public List<String> violations() {
        List<String> violations = new ArrayList<>();
        if (koDate.isAfter(fieldworkStart)) {
            violations.add("koDate " + koDate + " is after fieldworkStart " + fieldworkStart);
        }
        if (fieldworkStart.isAfter(fieldworkEnd)) {
            violations.add("fieldworkStart " + fieldworkStart + " is after fieldworkEnd " + fieldworkEnd);
        }
        if (fieldworkEnd.isAfter(reportDue)) {
            violations.add("fieldworkEnd " + fieldworkEnd + " is after reportDue " + reportDue);
        }
        return violations;
    }

    @JsonIgnore
    public boolean isConsistent() {
        return violations().isEmpty();
    }
}
