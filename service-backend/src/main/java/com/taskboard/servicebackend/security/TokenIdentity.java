package com.taskboard.servicebackend.security;

import java.time.Instant;

/**
 * Claims carried by a verified access token.
 */
public record TokenIdentity(
        long userId,
        String name,
        String email,
        Instant expiresAt
) {
}
