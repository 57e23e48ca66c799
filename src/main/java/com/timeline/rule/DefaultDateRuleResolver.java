package com.timeline.rule;

import com.timeline.exception.InvalidAnchorDateException;
import com.timeline.model.AnchorLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;

/**
 * Default implementation of DateRuleResolver.
 * Walks the rule table in order; a group whose keyword is present but whose
 * modifiers all miss does not stop the walk.
 */
public class DefaultDateRuleResolver implements DateRuleResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultDateRuleResolver.class);

    private final DateRuleTable table;

    public DefaultDateRuleResolver() {
        this(DateRuleTable.defaults());
    }

    public DefaultDateRuleResolver(DateRuleTable table) {
        this.table = table;
        log.debug("DateRuleResolver initialized with {} rule groups", table.entries().size());
    }

    @Override
    public ResolutionResult resolve(String taskId, String rule, AnchorLookup anchors) {
        if (rule == null || rule.isBlank()) {
            return DefaultResolutionResult.noDate("No date rule");
        }

        String normalized = rule.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals(table.ongoing())) {
            return DefaultResolutionResult.noDate("Ongoing task has no fixed date");
        }

        try {
            for (DateRuleEntry entry : table.entries()) {
                if (!entry.appliesTo(normalized)) {
                    continue;
                }
                Optional<RuleModifier> modifier = entry.modifierFor(normalized);
                if (modifier.isEmpty()) {
                    log.trace("Rule group {} applies to \"{}\" but no modifier matched", entry.name(), rule);
                    continue;
                }
                return apply(taskId, rule, entry, modifier.get(), anchors);
            }
        } catch (RuntimeException e) {
            log.error("Error calculating date for task {} with date rule \"{}\"", taskId, rule, e);
            return DefaultResolutionResult.unresolvable(rule);
        }

        log.warn("No date pattern matched for task {}: \"{}\"", taskId, rule);
        return DefaultResolutionResult.unresolvable(rule);
    }

    private ResolutionResult apply(String taskId, String rule, DateRuleEntry entry,
                                   RuleModifier modifier, AnchorLookup anchors) {
        LocalDate anchor;
        try {
            anchor = anchors.anchor(entry.anchor());
        } catch (InvalidAnchorDateException e) {
            log.warn("Cannot resolve date rule \"{}\" for task {}: {}", rule, taskId, e.getMessage());
            return DefaultResolutionResult.invalidAnchor(entry, e.getMessage());
        }

        LocalDate dueDate = modifier.shift().apply(anchor);
        log.debug("Task {} date rule \"{}\" matched {} -> {}", taskId, rule, entry.name(), dueDate);
        return DefaultResolutionResult.resolved(dueDate, entry, modifier);
    }

    @Override
    public DateRuleTable getTable() {
        return table;
    }
}
