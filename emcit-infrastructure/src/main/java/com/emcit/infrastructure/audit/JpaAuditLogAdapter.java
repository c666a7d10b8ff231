package com.emcit.infrastructure.audit;

import com.emcit.application.ports.AuditLogPort;
import com.emcit.domain.audit.AuditEntry;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Adapter: append-only audit rows. Appends run in their own transaction so an audit failure
 * cannot mark the caller's transaction rollback-only.
 */
@Component
public class JpaAuditLogAdapter implements AuditLogPort {

  private final AuditLogRepository audits;

  public JpaAuditLogAdapter(AuditLogRepository audits) {
    this.audits = audits;
  }

  @Override
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void append(AuditEntry entry) {
    audits.save(new AuditLogEntity(
        entry.id(),
        entry.actorId(),
        entry.action(),
        entry.target(),
        entry.originAddress(),
        entry.requestId(),
        entry.timestamp()
    ));
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEntry> recent(int limit) {
    var page = audits.findAll(PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "createdAt")));
    return page.getContent().stream()
        .map(e -> new AuditEntry(
            e.getId(),
            e.getActorId(),
            e.getAction(),
            e.getTargetEntity(),
            e.getIpAddress(),
            e.getRequestId(),
            e.getCreatedAt()))
        .toList();
  }
}
