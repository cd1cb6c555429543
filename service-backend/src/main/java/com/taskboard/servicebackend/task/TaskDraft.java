package com.taskboard.servicebackend.task;

import java.time.LocalDateTime;

/**
 * Validated create request. {@code description} and {@code dueDate} may be null.
 */
public record TaskDraft(String title, String description, Priority priority, LocalDateTime dueDate) {
}
