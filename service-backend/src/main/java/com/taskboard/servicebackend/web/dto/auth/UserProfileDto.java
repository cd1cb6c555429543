package com.taskboard.servicebackend.web.dto.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.taskboard.servicebackend.user.AppUser;

import java.time.Instant;

public record UserProfileDto(
        Long id,
        String name,
        String email,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {
    public static UserProfileDto from(AppUser user) {
        return new UserProfileDto(user.getId(), user.getName(), user.getEmail(),
                user.getCreatedAt(), user.getUpdatedAt());
    }
}
