package com.taskboard.servicebackend.error;

import org.springframework.http.HttpStatus;

import java.util.List;

public class NotFoundException extends TaskboardException {

    public NotFoundException(String message, String detail) {
        super(HttpStatus.NOT_FOUND, message, List.of(detail));
    }

    /**
     * The one failure reported for a task that is missing and for a task owned by someone else.
     */
    public static NotFoundException task() {
        return new NotFoundException("Task not found",
                "The task does not exist or you do not have access to it");
    }

    public static NotFoundException user() {
        return new NotFoundException("User not found", "The user does not exist");
    }
}
