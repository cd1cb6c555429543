package com.taskboard.servicebackend.web.dto;

import java.util.List;

public record PaginatedResponse<T>(
        boolean success,
        String message,
        List<T> data,
        PaginationDto pagination
) {
    public static <T> PaginatedResponse<T> of(String message, List<T> data, PaginationDto pagination) {
        return new PaginatedResponse<>(true, message, data, pagination);
    }
}
