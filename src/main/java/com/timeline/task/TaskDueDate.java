package com.timeline.task;

/**
 * Calculated due date for one task; {@code dueDate} is {@code YYYY-MM-DD} or null.
 */
public record TaskDueDate(String taskId, String dueDate) {
}
