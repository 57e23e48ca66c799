package com.timeline.rule;

import java.time.LocalDate;
import java.util.Locale;

/**
 * How a matched rule moves its anchor date.
 */
public enum DateShift {
    SAME_DAY {
        @Override
        public LocalDate apply(LocalDate anchor) {
            return anchor;
        }
    },
    PREVIOUS_BUSINESS_DAY {
        @Override
        public LocalDate apply(LocalDate anchor) {
            return BusinessDays.previous(anchor);
        }
    },
    NEXT_BUSINESS_DAY {
        @Override
        public LocalDate apply(LocalDate anchor) {
            return BusinessDays.next(anchor);
        }
    },
    WEEK_BEFORE {
        @Override
        public LocalDate apply(LocalDate anchor) {
            return anchor.minusDays(7);
        }
    };

    public abstract LocalDate apply(LocalDate anchor);

    /**
     * Parse a configuration value such as {@code previous-business-day}.
     */
    public static DateShift parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace("-", "_"));
    }
}
