package com.taskboard.servicebackend.web.dto.auth;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record SignUpRequest(
        @NotBlank(message = "name is required")
        @Size(min = 3, max = 200, message = "name must be between 3 and 200 characters")
        String name,
        @NotBlank(message = "email is required")
        @Pattern(regexp = ProfileFields.EMAIL_REGEX, message = ProfileFields.EMAIL_MESSAGE)
        String email,
        @NotBlank(message = "password is required")
        @Size(min = 6, max = 100, message = "password must be at least 6 characters long")
        String password
) {
    public SignUpRequest {
        name = ProfileFields.trim(name);
        email = ProfileFields.trim(email);
    }
}
