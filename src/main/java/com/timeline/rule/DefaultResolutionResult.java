package com.timeline.rule;

import java.time.LocalDate;

/**
 * Default implementation of ResolutionResult.
 */
public class DefaultResolutionResult implements ResolutionResult {

    private final ResolutionStatus status;
    private final LocalDate dueDate;
    private final ResolutionError error;
    private final String matchedRule;
    private final String explanation;

    private DefaultResolutionResult(ResolutionStatus status, LocalDate dueDate, ResolutionError error,
                                    String matchedRule, String explanation) {
        this.status = status;
        this.dueDate = dueDate;
        this.error = error;
        this.matchedRule = matchedRule;
        this.explanation = explanation;
    }

    @Override
    public ResolutionStatus getStatus() {
        return status;
    }

    @Override
    public LocalDate getDueDate() {
        return dueDate;
    }

    @Override
    public ResolutionError getError() {
        return error;
    }

    @Override
    public String getMatchedRule() {
        return matchedRule;
    }

    @Override
    public String getExplanation() {
        return explanation;
    }

    @Override
    public String toString() {
        return "ResolutionResult{" +
                "status=" + status +
                ", dueDate=" + dueDate +
                ", error=" + error +
                ", rule=" + (matchedRule != null ? matchedRule : "none") +
                '}';
    }

    public static ResolutionResult resolved(LocalDate dueDate, DateRuleEntry entry, RuleModifier modifier) {
        String explanation = "Matched " + entry.name() + " (" + modifier + ") on " + entry.anchor();
        return new DefaultResolutionResult(ResolutionStatus.RESOLVED, dueDate, null, entry.name(), explanation);
    }

    public static ResolutionResult noDate(String explanation) {
        return new DefaultResolutionResult(ResolutionStatus.NO_DATE, null, null, null, explanation);
    }

    public static ResolutionResult unresolvable(String rule) {
        return new DefaultResolutionResult(ResolutionStatus.FAILED, null, ResolutionError.UNRESOLVABLE_RULE,
                null, "No date pattern matched for: \"" + rule + "\"");
    }

    public static ResolutionResult invalidAnchor(DateRuleEntry entry, String reason) {
        return new DefaultResolutionResult(ResolutionStatus.FAILED, null, ResolutionError.INVALID_ANCHOR_DATE,
                entry.name(), reason);
    }
}
