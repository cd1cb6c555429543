package com.taskboard.servicebackend.web.dto;

import com.taskboard.servicebackend.task.TaskPage;

public record PaginationDto(
        int page,
        int limit,
        long total,
        int totalPages,
        boolean hasNext,
        boolean hasPrev
) {
    public static PaginationDto from(TaskPage page) {
        return new PaginationDto(page.page(), page.limit(), page.total(),
                page.totalPages(), page.hasNext(), page.hasPrevious());
    }
}
