package com.emcit.domain.access;

import java.util.Locale;
import java.util.Optional;

public enum Role {
    USER,
    ADMIN,
    SUPER_ADMIN;

    /**
     * Parses the role as stored in the users table / JWT claim ("user", "admin", "super_admin").
     * Unknown or blank values yield empty so callers can fail closed.
     */
    public static Optional<Role> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (Role r : values()) {
            if (r.name().equals(v)) return Optional.of(r);
        }
        return Optional.empty();
    }

    public String claim() {
        return name().toLowerCase(Locale.ROOT);
    }
}
