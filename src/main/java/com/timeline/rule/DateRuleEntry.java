package com.timeline.rule;

import com.timeline.model.AnchorKind;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * One keyword group of the date rule table.
 *
 * @param name      Identifier used in diagnostics
 * @param anchor    Anchor date the group computes from
 * @param keywords  Lower-case phrases; the group applies when any of them occurs in the rule
 * @param modifiers Modifiers tried in order; the first match commits the result
 */
public record DateRuleEntry(
        String name,
        AnchorKind anchor,
        List<String> keywords,
        List<RuleModifier> modifiers
) {

    public DateRuleEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(anchor, "anchor");
        keywords = keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        modifiers = List.copyOf(modifiers);
    }

    public boolean appliesTo(String normalizedRule) {
        return keywords.stream().anyMatch(normalizedRule::contains);
    }

    /**
     * Find the modifier for a rule this group applies to.
     * Empty means the group does not commit and evaluation moves on to the next group.
     */
    public Optional<RuleModifier> modifierFor(String normalizedRule) {
        return modifiers.stream().filter(m -> m.matches(normalizedRule)).findFirst();
    }
}
