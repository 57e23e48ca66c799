package com.timeline.rule;

public enum ResolutionStatus {
    /** A rule group matched and produced a date. */
    RESOLVED,
    /** Blank or ongoing rule: no fixed date is intended. */
    NO_DATE,
    /** The rule could not be turned into a date; see {@link ResolutionError}. */
    FAILED
}
