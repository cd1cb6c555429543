package com.taskboard.servicebackend.task;

/**
 * Raw, unvalidated create request.
 */
public record NewTaskInput(String title, String description, String priority, String dueDate) {
}
