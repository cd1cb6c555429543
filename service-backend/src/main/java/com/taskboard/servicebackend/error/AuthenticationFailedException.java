package com.taskboard.servicebackend.error;

import org.springframework.http.HttpStatus;

import java.util.List;

public class AuthenticationFailedException extends TaskboardException {

    public AuthenticationFailedException(String message) {
        super(HttpStatus.UNAUTHORIZED, message, List.of("Invalid credentials"));
    }
}
