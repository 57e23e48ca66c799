package com.timeline.rule;

/**
 * Why a date rule failed to resolve.
 */
public enum ResolutionError {
    UNRESOLVABLE_RULE,
    INVALID_ANCHOR_DATE
}
