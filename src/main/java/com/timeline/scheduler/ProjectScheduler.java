package com.timeline.scheduler;

import com.timeline.assignment.RoleAssignmentEngine;
import com.timeline.exception.InconsistentAnchorsException;
import com.timeline.model.AnchorDates;
import com.timeline.model.Task;
import com.timeline.model.TeamMember;
import com.timeline.segment.PhaseTimeline;
import com.timeline.segment.TimelineSegmentBuilder;
import com.timeline.task.TaskGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;

/**
 * Entry point for hosts: rebuilds a project's timeline and due dates after an
 * anchor edit, and sets up the task list of a new project.
 */
public class ProjectScheduler {

    private static final Logger log = LoggerFactory.getLogger(ProjectScheduler.class);

    private final TimelineSegmentBuilder segmentBuilder;
    private final RoleAssignmentEngine assignmentEngine;
    private final TaskGenerator taskGenerator;

    public ProjectScheduler(TimelineSegmentBuilder segmentBuilder,
                            RoleAssignmentEngine assignmentEngine,
                            TaskGenerator taskGenerator) {
        this.segmentBuilder = segmentBuilder;
        this.assignmentEngine = assignmentEngine;
        this.taskGenerator = taskGenerator;
    }

    /**
     * Rebuild segments and due dates. Same inputs always give the same result.
     */
    public ScheduleResult schedule(AnchorDates anchors, List<Task> tasks) {
        PhaseTimeline timeline;
        try {
            timeline = segmentBuilder.buildSegments(anchors);
        } catch (InconsistentAnchorsException e) {
            log.warn("Project timeline not built: {}", e.getMessage());
            return ScheduleResult.failure(e.getMessage(), tasks);
        }
        List<Task> stamped = segmentBuilder.applyDueDates(timeline, tasks);
        return ScheduleResult.success(timeline, segmentBuilder.keyDates(timeline), stamped);
    }

    /**
     * Set up a new project: build the timeline, generate tasks from the catalog
     * and assign role-tagged tasks to the founding team.
     */
    public ScheduleResult createProject(AnchorDates anchors, String methodologyType, boolean requireAdvancedAnalytics,
                                        List<TeamMember> team, LocalDate today) {
        PhaseTimeline timeline;
        try {
            timeline = segmentBuilder.buildSegments(anchors);
        } catch (InconsistentAnchorsException e) {
            log.warn("Project not created: {}", e.getMessage());
            return ScheduleResult.failure(e.getMessage(), List.of());
        }

        List<Task> tasks = taskGenerator.generate(methodologyType, requireAdvancedAnalytics, timeline, today);
        if (!team.isEmpty()) {
            tasks = assignmentEngine.reassignAll(team, tasks);
        } else {
            log.info("Auto-assignment skipped, no team members");
        }
        log.info("Created project schedule with {} tasks, {} assigned",
                tasks.size(), tasks.stream().filter(t -> !t.assignedTo().isEmpty()).count());
        return ScheduleResult.success(timeline, segmentBuilder.keyDates(timeline), tasks);
    }

    /**
     * Forward a roster role edit to the assignment engine.
     */
    public List<Task> onRoleChanged(String memberId, String role, boolean added,
                                    List<TeamMember> roster, List<Task> tasks) {
        return assignmentEngine.onRoleChanged(memberId, role, added, roster, tasks);
    }
}
