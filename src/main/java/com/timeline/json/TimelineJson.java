package com.timeline.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.timeline.model.PhaseSegment;
import com.timeline.model.ProjectTimeline;
import com.timeline.model.Task;
import com.timeline.model.TeamMember;
import com.timeline.task.TaskDateRequest;
import com.timeline.task.TaskDueDate;

import java.util.List;

/**
 * Reads and writes the plain JSON shapes hosts exchange with the engine.
 * Dates travel as {@code YYYY-MM-DD} strings; unknown fields are ignored.
 */
public final class TimelineJson {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private TimelineJson() {
    }

    public static ProjectTimeline readTimeline(String json) {
        return read(json, new TypeReference<ProjectTimeline>() {});
    }

    public static List<Task> readTasks(String json) {
        return read(json, new TypeReference<List<Task>>() {});
    }

    public static List<TeamMember> readRoster(String json) {
        return read(json, new TypeReference<List<TeamMember>>() {});
    }

    public static List<TaskDateRequest> readDateRequests(String json) {
        return read(json, new TypeReference<List<TaskDateRequest>>() {});
    }

    public static String writeTasks(List<Task> tasks) {
        return write(tasks);
    }

    public static String writeSegments(List<PhaseSegment> segments) {
        return write(segments);
    }

    public static String writeDueDates(List<TaskDueDate> dueDates) {
        return write(dueDates);
    }

    private static <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    private static String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
