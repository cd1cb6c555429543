package com.taskboard.servicebackend.web.dto.task;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskboard.servicebackend.task.Task;

import java.time.Instant;
import java.time.LocalDateTime;

public record TaskDto(
        Long id,
        String title,
        String description,
        boolean completed,
        String priority,
        @JsonProperty("due_date") @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss") LocalDateTime dueDate,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {
    public static TaskDto from(Task task) {
        return new TaskDto(
                task.getId(),
                task.getTitle(),
                task.getDescription(),
                task.isCompleted(),
                task.getPriority().code(),
                task.getDueDate(),
                task.getCreatedAt(),
                task.getUpdatedAt());
    }
}
