package com.taskboard.servicebackend.error;

import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Base class of every failure the API reports to its caller with a specific status code.
 * The message is user facing; {@link #getErrors()} is always a non-empty list.
 */
public abstract class TaskboardException extends RuntimeException {

    private final HttpStatus status;
    private final List<String> errors;

    protected TaskboardException(HttpStatus status, String message, List<String> errors) {
        super(message);
        this.status = status;
        this.errors = errors == null || errors.isEmpty() ? List.of(message) : List.copyOf(errors);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public List<String> getErrors() {
        return errors;
    }
}
