package com.timeline.rule;

import com.timeline.model.AnchorLookup;

/**
 * Turns a free-text date rule into a calendar date relative to the project anchors.
 * Implementations never throw; failures come back as {@link ResolutionStatus#FAILED} results.
 */
public interface DateRuleResolver {

    /**
     * Resolve a rule for a specific task.
     *
     * @param taskId  Task the rule belongs to, used in diagnostics; may be null
     * @param rule    Rule text, may be null or blank
     * @param anchors Anchor dates of the project
     * @return Resolution outcome
     */
    ResolutionResult resolve(String taskId, String rule, AnchorLookup anchors);

    default ResolutionResult resolve(String rule, AnchorLookup anchors) {
        return resolve(null, rule, anchors);
    }

    /**
     * Get the vocabulary this resolver evaluates.
     */
    DateRuleTable getTable();
}
