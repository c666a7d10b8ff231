package com.emcit.application.ports;

import com.emcit.domain.audit.AuditEntry;

import java.util.List;

/**
 * Append-only audit storage. Entries are never updated or deleted.
 */
public interface AuditLogPort {

    void append(AuditEntry entry);

    List<AuditEntry> recent(int limit);
}
