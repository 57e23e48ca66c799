package com.timeline.rule;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Weekday arithmetic. Saturdays and Sundays are never business days.
 */
public final class BusinessDays {

    private BusinessDays() {
    }

    public static boolean isBusinessDay(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    /**
     * The day before {@code date}, moved back to Friday if it lands on a weekend.
     */
    public static LocalDate previous(LocalDate date) {
        LocalDate prev = date.minusDays(1);
        return switch (prev.getDayOfWeek()) {
            case SATURDAY -> prev.minusDays(1);
            case SUNDAY -> prev.minusDays(2);
            default -> prev;
        };
    }

    /**
     * The day after {@code date}, moved forward to Monday if it lands on a weekend.
     */
    public static LocalDate next(LocalDate date) {
        LocalDate next = date.plusDays(1);
        return switch (next.getDayOfWeek()) {
            case SATURDAY -> next.plusDays(2);
            case SUNDAY -> next.plusDays(1);
            default -> next;
        };
    }
}
