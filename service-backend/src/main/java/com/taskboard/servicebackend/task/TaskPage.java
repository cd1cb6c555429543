package com.taskboard.servicebackend.task;

import java.util.List;

/**
 * One page of a listing together with the counts computed from the same filter.
 */
public record TaskPage(List<Task> items, int page, int limit, long total) {

    public TaskPage {
        items = List.copyOf(items);
    }

    public int totalPages() {
        return (int) ((total + limit - 1) / limit);
    }

    public boolean hasNext() {
        return page < totalPages();
    }

    public boolean hasPrevious() {
        return page > 1;
    }
}
