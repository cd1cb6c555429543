package com.taskboard.servicebackend.error;

import org.springframework.http.HttpStatus;

import java.util.List;

public class ValidationException extends TaskboardException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message, List.of(message));
    }

    public ValidationException(String message, List<String> errors) {
        super(HttpStatus.BAD_REQUEST, message, errors);
    }
}
