package com.timeline.scheduler;

import com.timeline.model.KeyDate;
import com.timeline.model.Task;
import com.timeline.segment.PhaseTimeline;

import java.util.List;

/**
 * Outcome of scheduling one project: either a timeline with stamped tasks,
 * or the single error that stopped the build.
 */
public final class ScheduleResult {

    private final PhaseTimeline timeline;
    private final List<KeyDate> keyDates;
    private final List<Task> tasks;
    private final String error;

    private ScheduleResult(PhaseTimeline timeline, List<KeyDate> keyDates, List<Task> tasks, String error) {
        this.timeline = timeline;
        this.keyDates = keyDates;
        this.tasks = tasks;
        this.error = error;
    }

    public static ScheduleResult success(PhaseTimeline timeline, List<KeyDate> keyDates, List<Task> tasks) {
        return new ScheduleResult(timeline, List.copyOf(keyDates), List.copyOf(tasks), null);
    }

    /**
     * Failed build. The tasks are handed back untouched.
     */
    public static ScheduleResult failure(String error, List<Task> tasks) {
        return new ScheduleResult(null, List.of(), List.copyOf(tasks), error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Null when the build failed.
     */
    public PhaseTimeline getTimeline() {
        return timeline;
    }

    public List<KeyDate> getKeyDates() {
        return keyDates;
    }

    public List<Task> getTasks() {
        return tasks;
    }

    /**
     * Null when the build succeeded.
     */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ScheduleResult{success, " + tasks.size() + " tasks, " + timeline.startDate() + ".." + timeline.endDate() + "}"
                : "ScheduleResult{failed: " + error + "}";
    }
}
