package com.timeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Canonical project phases, in timeline order.
 */
public enum Phase {
    KICKOFF("Kickoff"),
    PRE_FIELD("Pre-Field"),
    FIELDING("Fielding"),
    POST_FIELD_ANALYSIS("Post-Field Analysis"),
    REPORTING("Reporting");

    private final String displayName;

    Phase(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    /**
     * Look up a phase by its display name, ignoring case and surrounding blanks.
     *
     * @return The phase, or null when the name is unknown
     */
    @JsonCreator
    public static Phase fromDisplayName(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        for (Phase phase : values()) {
            if (phase.displayName.equalsIgnoreCase(trimmed)) {
                return phase;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
