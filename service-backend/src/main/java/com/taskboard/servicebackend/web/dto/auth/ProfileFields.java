package com.taskboard.servicebackend.web.dto.auth;

/**
 * Shared rules for profile fields. Values are trimmed before the length and format checks run.
 */
final class ProfileFields {
    static final String EMAIL_REGEX = "^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$";
    static final String EMAIL_MESSAGE = "email must be valid";

    private ProfileFields() {
    }

    static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
