package com.taskboard.servicebackend.task;

import com.taskboard.servicebackend.error.ValidationException;

import java.util.List;

/**
 * Listing filters. Every component is optional; {@code null} means "do not filter on this".
 *
 * @param completed tri-state completion filter
 * @param priority  exact priority
 * @param search    case-insensitive substring of title or description, already trimmed
 */
public record TaskFilter(Boolean completed, Priority priority, String search) {

    /** Search terms shorter than this after trimming are dropped. */
    public static final int MIN_SEARCH_LENGTH = 2;

    public static TaskFilter none() {
        return new TaskFilter(null, null, null);
    }

    /**
     * Parses raw query parameters. Unrecognized {@code completed} values mean "no filter";
     * an unknown priority is rejected.
     */
    public static TaskFilter parse(String completed, String priority, String search) {
        Boolean completedFilter = null;
        if ("true".equals(completed)) {
            completedFilter = Boolean.TRUE;
        } else if ("false".equals(completed)) {
            completedFilter = Boolean.FALSE;
        }

        Priority priorityFilter = null;
        if (priority != null && !priority.isEmpty()) {
            priorityFilter = Priority.fromCode(priority).orElseThrow(() -> new ValidationException(
                    "Priority must be one of: low, medium, high",
                    List.of("Priority filter \"" + priority + "\" is not valid")));
        }

        String term = null;
        if (search != null) {
            String trimmed = search.trim();
            if (trimmed.length() >= MIN_SEARCH_LENGTH) {
                term = trimmed;
            }
        }
        return new TaskFilter(completedFilter, priorityFilter, term);
    }
}
