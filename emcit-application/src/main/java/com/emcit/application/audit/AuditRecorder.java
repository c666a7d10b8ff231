package com.emcit.application.audit;

import com.emcit.application.guard.AccessGate;
import com.emcit.application.ports.AuditLogPort;
import com.emcit.domain.access.Actor;
import com.emcit.domain.audit.AuditEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Best-effort audit trail.
 *
 * A failed append is logged and dropped: it never aborts or rolls back the operation it
 * accompanies.
 */
public final class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    private static final int MAX_LIMIT = 200;

    private final AuditLogPort auditLog;
    private final Clock clock;
    private final Supplier<String> requestIds;

    public AuditRecorder(AuditLogPort auditLog, Clock clock, Supplier<String> requestIds) {
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.requestIds = requestIds == null ? () -> null : requestIds;
    }

    public void record(UUID actorId, String action, String target, String originAddress) {
        try {
            auditLog.append(new AuditEntry(
                    UUID.randomUUID(),
                    actorId,
                    action,
                    target,
                    originAddress,
                    requestIds.get(),
                    clock.instant()
            ));
        } catch (Exception e) {
            log.warn("AUDIT LOG FAILED action={} target={}: {}", action, target, e.toString());
        }
    }

    public void record(Actor actor, String action, String target, String originAddress) {
        record(actor == null ? null : actor.userId(), action, target, originAddress);
    }

    public List<AuditEntry> recent(Actor actor, int limit) {
        AccessGate.require(actor, AccessGate.ADMINS);
        int size = Math.max(1, Math.min(MAX_LIMIT, limit));
        return auditLog.recent(size);
    }
}
