package com.timeline.config;

import com.timeline.model.TaskTemplate;
import com.timeline.rule.DateRuleTable;

import java.util.List;

/**
 * Root configuration for the timeline engine.
 *
 * @param name          Configuration name
 * @param version       Configuration version
 * @param dateRules     Date rule vocabulary, in priority order
 * @param taskTemplates Task catalog new projects are generated from
 */
public record SchedulingConfig(
        String name,
        String version,
        DateRuleTable dateRules,
        List<TaskTemplate> taskTemplates
) {

    public SchedulingConfig {
        taskTemplates = taskTemplates == null ? List.of() : List.copyOf(taskTemplates);
    }

    /**
     * Built-in rule vocabulary and an empty catalog.
     */
    public static SchedulingConfig defaults() {
        return new SchedulingConfig("default", "1.0", DateRuleTable.defaults(), List.of());
    }
}
