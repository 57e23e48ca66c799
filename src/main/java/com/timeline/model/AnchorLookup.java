package com.timeline.model;

import java.time.LocalDate;

/**
 * Supplies anchor dates to the date rule resolver.
 */
@FunctionalInterface
public interface AnchorLookup {

    /**
     * Get the date for the given anchor.
     *
     * @param kind Anchor to look up
     * @return The anchor date, never null
     * @throws com.timeline.exception.InvalidAnchorDateException if the anchor is missing or malformed
     */
    LocalDate anchor(AnchorKind kind);
}
