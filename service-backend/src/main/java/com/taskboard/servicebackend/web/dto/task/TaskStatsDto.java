package com.taskboard.servicebackend.web.dto.task;

import com.taskboard.servicebackend.task.Priority;
import com.taskboard.servicebackend.task.TaskStats;

import java.util.LinkedHashMap;
import java.util.Map;

public record TaskStatsDto(
        long total,
        long completed,
        long pending,
        Map<String, Long> byPriority
) {
    public static TaskStatsDto from(TaskStats stats) {
        Map<String, Long> byPriority = new LinkedHashMap<>();
        for (Priority priority : Priority.values()) {
            byPriority.put(priority.code(), stats.count(priority));
        }
        return new TaskStatsDto(stats.total(), stats.completed(), stats.pending(), byPriority);
    }
}
