package com.timeline.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * A project task.
 *
 * <p>{@code dueDate} is derived from {@code dateRule} once a rule exists, and
 * {@code assignedTo} is derived from the roster once a {@code role} is set.
 * Ongoing tasks never carry a due date.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Task(
        String id,
        String description,
        String phase,
        String role,
        @JsonAlias("dateNotes") String dateRule,
        LocalDate dueDate,
        @JsonProperty("isOngoing") boolean ongoing,
        List<String> assignedTo,
        TaskStatus status,
        String notes
) {

    public Task {
        if (ongoing && dueDate != null) {
            throw new IllegalArgumentException("Ongoing task " + id + " cannot have a due date");
        }
        assignedTo = assignedTo == null ? List.of() : List.copyOf(assignedTo);
        status = status == null ? TaskStatus.PENDING : status;
    }

    /**
     * Create a pending, unassigned task.
     */
    public static Task of(String id, String description, String phase, String role, String dateRule) {
        return new Task(id, description, phase, role, dateRule, null, false, List.of(), TaskStatus.PENDING, null);
    }

    @JsonIgnore
    public boolean isRoleTagged() {
        return role != null && !role.isBlank();
    }

    public Task withDueDate(LocalDate newDueDate) {
        return new Task(id, description, phase, role, dateRule, newDueDate, ongoing, assignedTo, status, notes);
    }

    public Task withOngoing(boolean newOngoing) {
        return new Task(id, description, phase, role, dateRule, newOngoing ? null : dueDate,
                newOngoing, assignedTo, status, notes);
    }

    public Task withAssignedTo(List<String> newAssignedTo) {
        return new Task(id, description, phase, role, dateRule, dueDate, ongoing, newAssignedTo, status, notes);
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, description, phase, role, dateRule, dueDate, ongoing, assignedTo, newStatus, notes);
    }

    public Task withNotes(String newNotes) {
        return new Task(id, description, phase, role, dateRule, dueDate, ongoing, assignedTo, status, newNotes);
    }
}
