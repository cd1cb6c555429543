package com.taskboard.servicebackend.web.dto.auth;

import com.taskboard.servicebackend.user.AppUser;

/**
 * Body of a successful registration or login: the bearer token and the caller's profile.
 */
public record AuthResponse(
        String token,
        UserProfileDto user
) {
    public static AuthResponse issued(String token, AppUser user) {
        return new AuthResponse(token, UserProfileDto.from(user));
    }
}
