package com.timeline.task;

import com.timeline.model.ProjectTimeline;
import com.timeline.rule.DateRuleResolver;
import com.timeline.rule.ResolutionResult;

import java.util.List;

/**
 * String-in, string-out due date calculation for host applications.
 */
public class TaskDueDateCalculator {

    private final DateRuleResolver resolver;

    public TaskDueDateCalculator(DateRuleResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Calculate one task's due date.
     *
     * @return {@code YYYY-MM-DD}, or null for ongoing, blank or unresolvable rules
     */
    public String calculateTaskDueDate(TaskDateRequest task, ProjectTimeline timeline) {
        return resolve(task, timeline).getFormattedDueDate();
    }

    /**
     * Full outcome for one task, for callers that need to tell "no date" from "failed".
     */
    public ResolutionResult resolve(TaskDateRequest task, ProjectTimeline timeline) {
        return resolver.resolve(task.id(), task.dateNotes(), timeline);
    }

    /**
     * Calculate due dates for many tasks. One bad rule never affects the others.
     *
     * @return One entry per task, in input order
     */
    public List<TaskDueDate> calculateTaskDueDates(List<TaskDateRequest> tasks, ProjectTimeline timeline) {
        return tasks.stream()
                .map(task -> new TaskDueDate(task.id(), calculateTaskDueDate(task, timeline)))
                .toList();
    }
}
