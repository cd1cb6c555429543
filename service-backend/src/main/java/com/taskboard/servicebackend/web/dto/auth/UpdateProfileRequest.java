package com.taskboard.servicebackend.web.dto.auth;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Both fields optional; a {@code null} field is left unchanged.
 */
public record UpdateProfileRequest(
        @Size(min = 3, max = 200, message = "name must be between 3 and 200 characters")
        String name,
        @Pattern(regexp = ProfileFields.EMAIL_REGEX, message = ProfileFields.EMAIL_MESSAGE)
        String email
) {
    public UpdateProfileRequest {
        name = ProfileFields.trim(name);
        email = ProfileFields.trim(email);
    }
}
