package com.timeline.rule;

import java.util.Locale;
import java.util.Objects;

/**
 * Modifier phrase inside a rule group and the shift it selects.
 *
 * @param when  Lower-case phrase that must appear in the rule, or null to match unconditionally
 * @param shift Shift applied to the group's anchor
 */
public record RuleModifier(String when, DateShift shift) {

    public RuleModifier {
        Objects.requireNonNull(shift, "shift");
        when = when == null || when.isBlank() ? null : when.toLowerCase(Locale.ROOT);
    }

    public static RuleModifier when(String phrase, DateShift shift) {
        return new RuleModifier(phrase, shift);
    }

    public static RuleModifier otherwise(DateShift shift) {
        return new RuleModifier(null, shift);
    }

    public boolean matches(String normalizedRule) {
        return when == null || normalizedRule.contains(when);
    }

    @Override
    public String toString() {
        return (when == null ? "otherwise" : "'" + when + "'") + " -> " + shift;
    }
}
