package com.emcit.domain.access;

import java.util.Objects;
import java.util.UUID;

/**
 * Authenticated identity acting on the system.
 * An unauthenticated caller is represented by a {@code null} actor, never by a placeholder.
 */
public record Actor(UUID userId, Role role) {
    public Actor {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(role, "role");
    }

    public boolean hasRole(Role r) {
        return role == r;
    }
}
