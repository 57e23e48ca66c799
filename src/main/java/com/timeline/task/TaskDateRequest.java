package com.timeline.task;

/**
 * A task as the host sends it for due-date calculation.
 *
 * @param id        Task id
 * @param dateNotes Date rule text
 * @param task      Task description
 * @param phase     Phase display name
 */
public record TaskDateRequest(String id, String dateNotes, String task, String phase) {
}
