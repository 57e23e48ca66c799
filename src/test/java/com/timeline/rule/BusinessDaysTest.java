package com.timeline.rule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class BusinessDaysTest {

    @ParameterizedTest
    @DisplayName("Previous business day skips back over weekends")
    @CsvSource({
            "2025-03-10, 2025-03-07",   // Monday -> Friday
            "2025-03-09, 2025-03-07",   // Sunday -> Saturday -> Friday
            "2025-03-08, 2025-03-07",   // Saturday -> Friday
            "2025-03-12, 2025-03-11"    // Wednesday -> Tuesday
    })
    void previous(String date, String expected) {
        assertEquals(LocalDate.parse(expected), BusinessDays.previous(LocalDate.parse(date)));
    }

    @ParameterizedTest
    @DisplayName("Next business day skips forward over weekends")
    @CsvSource({
            "2025-04-04, 2025-04-07",   // Friday -> Monday
            "2025-04-05, 2025-04-07",   // Saturday -> Sunday -> Monday
            "2025-04-06, 2025-04-07",   // Sunday -> Monday
            "2025-04-08, 2025-04-09"    // Tuesday -> Wednesday
    })
    void next(String date, String expected) {
        assertEquals(LocalDate.parse(expected), BusinessDays.next(LocalDate.parse(date)));
    }

    @Test
    @DisplayName("Shifted dates are always business days")
    void shiftedDatesAreBusinessDays() {
        LocalDate day = LocalDate.of(2024, 12, 1);
        for (int i = 0; i < 60; i++) {
            assertTrue(BusinessDays.isBusinessDay(BusinessDays.previous(day)));
            assertTrue(BusinessDays.isBusinessDay(BusinessDays.next(day)));
            day = day.plusDays(1);
        }
    }

    @Test
    @DisplayName("Year boundary is crossed on calendar fields")
    void yearBoundary() {
        // 2026-01-01 is a Thursday
        assertEquals(LocalDate.of(2025, 12, 31), BusinessDays.previous(LocalDate.of(2026, 1, 1)));
        // 2027-01-01 is a Friday
        assertEquals(LocalDate.of(2027, 1, 4), BusinessDays.next(LocalDate.of(2027, 1, 1)));
    }
}
