package com.timeline.task;

import com.timeline.model.AnchorDates;
import com.timeline.model.Phase;
import com.timeline.model.Task;
import com.timeline.model.TaskStatus;
import com.timeline.model.TaskTemplate;
import com.timeline.rule.DateRuleResolver;
import com.timeline.segment.CurrentPhase;
import com.timeline.segment.PhaseTimeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Creates a new project's task list from the template catalog.
 */
public class TaskGenerator {

    private static final Logger log = LoggerFactory.getLogger(TaskGenerator.class);

    /**
     * Description keywords that mark a template as advanced analytics work.
     */
    public static final List<String> ANALYTICS_KEYWORDS = List.of("statistician", "spss");

    private final List<TaskTemplate> catalog;
    private final DateRuleResolver resolver;

    public TaskGenerator(List<TaskTemplate> catalog, DateRuleResolver resolver) {
        this.catalog = List.copyOf(catalog);
        this.resolver = resolver;
    }

    /**
     * Generate tasks for a project.
     *
     * @param methodologyType           "quantitative", "qualitative", their short forms, or another literal
     * @param requireAdvancedAnalytics  Whether statistician/SPSS tasks are kept
     * @param timeline                  Project timeline the due dates are computed from
     * @param today                     Date used to mark tasks of past phases as completed
     * @return Pending tasks with due dates, or an empty list when no methodology is given
     */
    public List<Task> generate(String methodologyType, boolean requireAdvancedAnalytics,
                               PhaseTimeline timeline, LocalDate today) {
        if (methodologyType == null || methodologyType.isBlank()) {
            log.info("No methodology type, no tasks generated");
            return List.of();
        }

        AnchorDates anchors = timeline.toAnchorDates();
        CurrentPhase current = timeline.currentPhase(today);
        int currentIndex = current.phase().ordinal();

        List<Task> tasks = new ArrayList<>();
        for (TaskTemplate template : catalog) {
            if (!matchesMethodology(template, methodologyType)) {
                continue;
            }
            if (!requireAdvancedAnalytics && isAnalyticsTask(template)) {
                continue;
            }
            if (template.description() == null || template.description().isBlank()) {
                continue;
            }
            tasks.add(toTask(template, anchors, timeline, today, currentIndex));
        }

        log.info("Generated {} of {} catalog tasks for methodology {} (current phase {} {})",
                tasks.size(), catalog.size(), methodologyType, current.phase(), current.state());
        return tasks;
    }

    private Task toTask(TaskTemplate template, AnchorDates anchors, PhaseTimeline timeline, LocalDate today,
                        int currentIndex) {
        String rule = template.dateRule();
        boolean ongoing = rule != null && rule.toLowerCase(Locale.ROOT).contains("ongoing");
        LocalDate dueDate = ongoing ? null : resolver.resolve(template.id(), rule, anchors).getDueDate();

        Phase phase = Phase.fromDisplayName(template.phase());
        TaskStatus status = phase != null && hasPassed(timeline, phase, today, currentIndex)
                ? TaskStatus.COMPLETED
                : TaskStatus.PENDING;
        if (status == TaskStatus.COMPLETED) {
            log.debug("Marking task {} complete, phase {} has passed", template.id(), phase);
        }

        return new Task(template.id(), template.description(), template.phase(), template.role(), rule,
                dueDate, ongoing, List.of(), status, template.notes());
    }

    // A collapsed phase has passed only after the day it collapsed onto.
    private static boolean hasPassed(PhaseTimeline timeline, Phase phase, LocalDate today, int currentIndex) {
        return phase.ordinal() < currentIndex && timeline.segment(phase).startDate().isBefore(today);
    }

    static boolean matchesMethodology(TaskTemplate template, String methodologyType) {
        if (template.quantQual() == null || template.quantQual().isBlank()) {
            return true;
        }
        String taskType = template.quantQual().toLowerCase(Locale.ROOT);
        String methodology = methodologyType.toLowerCase(Locale.ROOT);
        if (methodology.equals("quantitative") || methodology.equals("quant")) {
            return taskType.equals("quant");
        }
        if (methodology.equals("qualitative") || methodology.equals("qual")) {
            return taskType.equals("qual");
        }
        return taskType.equals(methodology);
    }

    static boolean isAnalyticsTask(TaskTemplate template) {
        String description = template.description() == null
                ? ""
                : template.description().toLowerCase(Locale.ROOT);
        return ANALYTICS_KEYWORDS.stream().anyMatch(description::contains);
    }

    public List<TaskTemplate> getCatalog() {
        return catalog;
    }
}
