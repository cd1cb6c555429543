package com.taskboard.servicebackend.web.dto.task;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskboard.servicebackend.task.NewTaskInput;

/**
 * Field rules are applied by the task validator so that every problem is reported at once.
 */
public record CreateTaskRequest(
        String title,
        String description,
        String priority,
        @JsonProperty("due_date") String dueDate
) {
    public NewTaskInput toInput() {
        return new NewTaskInput(title, description, priority, dueDate);
    }
}
