package com.taskboard.servicebackend.web.dto.auth;

import jakarta.validation.constraints.NotBlank;

public record SignInRequest(
        @NotBlank(message = "email is required") String email,
        @NotBlank(message = "password is required") String password
) {}
