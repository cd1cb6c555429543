package com.taskboard.servicebackend.error;

import org.springframework.http.HttpStatus;

import java.util.List;

public class ConflictException extends TaskboardException {

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, message, List.of(message));
    }

    public static ConflictException emailTaken() {
        return new ConflictException("Email is already registered");
    }
}
