package com.taskboard.servicebackend.task;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate counts for one owner. The priority breakdown always carries every priority.
 */
public record TaskStats(long total, long completed, Map<Priority, Long> byPriority) {

    public TaskStats {
        EnumMap<Priority, Long> complete = new EnumMap<>(Priority.class);
        for (Priority priority : Priority.values()) {
            complete.put(priority, byPriority.getOrDefault(priority, 0L));
        }
        byPriority = Collections.unmodifiableMap(complete);
    }

    public long pending() {
        return total - completed;
    }

    public long count(Priority priority) {
        return byPriority.get(priority);
    }
}
