package com.timeline.rule;

import java.time.LocalDate;

/**
 * Result of resolving one date rule.
 */
public interface ResolutionResult {

    ResolutionStatus getStatus();

    /**
     * Get the computed due date.
     * Null unless the status is {@link ResolutionStatus#RESOLVED}.
     */
    LocalDate getDueDate();

    /**
     * Due date as {@code YYYY-MM-DD}, or null.
     */
    default String getFormattedDueDate() {
        LocalDate dueDate = getDueDate();
        return dueDate != null ? dueDate.toString() : null;
    }

    /**
     * Get the failure reason. Null unless the status is {@link ResolutionStatus#FAILED}.
     */
    ResolutionError getError();

    /**
     * Name of the rule group that produced the date, or null.
     */
    String getMatchedRule();

    /**
     * Get human-readable explanation of the outcome.
     */
    String getExplanation();

    default boolean isResolved() {
        return getStatus() == ResolutionStatus.RESOLVED;
    }

    default boolean isFailed() {
        return getStatus() == ResolutionStatus.FAILED;
    }
}
