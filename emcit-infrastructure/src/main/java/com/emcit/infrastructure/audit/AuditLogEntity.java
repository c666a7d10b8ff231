package com.emcit.infrastructure.audit;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "audit_logs",
    indexes = {
        @Index(name = "ix_audit_logs_created_at", columnList = "created_at"),
        @Index(name = "ix_audit_logs_actor", columnList = "actor_id"),
        @Index(name = "ix_audit_logs_target", columnList = "target_entity")
    }
)
public class AuditLogEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "actor_id")
  private UUID actorId;

  @Column(name = "action", nullable = false, length = 128)
  private String action;

  @Column(name = "target_entity", nullable = false, length = 160)
  private String targetEntity;

  @Column(name = "ip_address", nullable = false, length = 64)
  private String ipAddress;

  @Column(name = "request_id", length = 128)
  private String requestId;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected AuditLogEntity() {}

  public AuditLogEntity(UUID id, UUID actorId, String action, String targetEntity,
                        String ipAddress, String requestId, Instant createdAt) {
    this.id = id;
    this.actorId = actorId;
    this.action = action;
    this.targetEntity = targetEntity;
    this.ipAddress = ipAddress;
    this.requestId = requestId;
    this.createdAt = createdAt;
  }

  public UUID getId() { return id; }
  public UUID getActorId() { return actorId; }
  public String getAction() { return action; }
  public String getTargetEntity() { return targetEntity; }
  public String getIpAddress() { return ipAddress; }
  public String getRequestId() { return requestId; }
  public Instant getCreatedAt() { return createdAt; }
}
