package com.taskboard.servicebackend.security;

import java.security.Principal;

public record AuthenticatedUser(Long id, String name, String email) implements Principal {
    @Override
    public String getName() {
        return name;
    }
}
