package com.taskboard.servicebackend.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param expiration       token lifetime in milliseconds
 * @param refreshThreshold remaining lifetime in milliseconds below which a fresh token is handed out
 */
@ConfigurationProperties(prefix = "jwt")
public record JwtProperties(
        String secret,
        long expiration,
        long refreshThreshold
) {
}
