package com.emcit.domain.audit;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable audit trail row. {@code actorId} is null for anonymous callers.
 */
public record AuditEntry(
        UUID id,
        UUID actorId,
        String action,
        String target,
        String originAddress,
        String requestId,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(timestamp, "timestamp");
        if (target == null) target = "-";
        if (originAddress == null || originAddress.isBlank()) originAddress = "Unknown";
    }
}
