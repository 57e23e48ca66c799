package com.timeline.exception;

import java.util.List;

/**
 * Exception thrown when a project's anchor dates are out of order.
 * Carries every violation found so the caller can report them in one message.
 */
public class InconsistentAnchorsException extends TimelineException {

    private final List<String> violations;

    public InconsistentAnchorsException(List<String> violations) {
        super("Inconsistent anchor dates: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
