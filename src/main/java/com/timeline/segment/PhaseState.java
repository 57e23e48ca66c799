package com.timeline.segment;

/**
 * Where "today" sits relative to the project timeline.
 */
public enum PhaseState {
    /** Before the first segment; the first phase is reported. */
    PENDING_START,
    /** Inside a segment. */
    ACTIVE,
    /** After the last segment; the last phase is reported. */
    OVERDUE
}
