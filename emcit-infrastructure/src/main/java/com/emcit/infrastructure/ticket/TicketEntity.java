package com.emcit.infrastructure.ticket;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "tickets",
    uniqueConstraints = @UniqueConstraint(name = "uk_tickets_uid", columnNames = "ticket_uid"),
    indexes = {
        @Index(name = "ix_tickets_user", columnList = "user_id"),
        @Index(name = "ix_tickets_created_at", columnList = "created_at")
    }
)
public class TicketEntity {

  public static final String STATUS_OPEN = "Open";
  public static final String STATUS_CLOSED = "Closed";
  public static final String PRIORITY_CRITICAL = "Critical";

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "ticket_uid", nullable = false, length = 40)
  private String ticketUid;

  @Column(name = "title", nullable = false, length = 200)
  private String title;

  @Column(name = "description", nullable = false, length = 8000)
  private String description;

  @Column(name = "category", length = 80)
  private String category;

  @Column(name = "priority", length = 32)
  private String priority;

  @Column(name = "status", nullable = false, length = 32)
  private String status;

  @Column(name = "attachment_url", length = 1000)
  private String attachmentUrl;

  @Column(name = "resolution_notes", length = 8000)
  private String resolutionNotes;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "assigned_admin")
  private UUID assignedAdmin;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected TicketEntity() {}

  public TicketEntity(UUID id, String ticketUid, String title, String description, String category,
                      String priority, String attachmentUrl, UUID userId, Instant createdAt) {
    this.id = id;
    this.ticketUid = ticketUid;
    this.title = title;
    this.description = description;
    this.category = category;
    this.priority = priority;
    this.attachmentUrl = attachmentUrl;
    this.userId = userId;
    this.createdAt = createdAt;
    this.status = STATUS_OPEN;
  }

  public UUID getId() { return id; }
  public String getTicketUid() { return ticketUid; }
  public String getTitle() { return title; }
  public String getDescription() { return description; }
  public String getCategory() { return category; }
  public String getPriority() { return priority; }
  public String getStatus() { return status; }
  public String getAttachmentUrl() { return attachmentUrl; }
  public String getResolutionNotes() { return resolutionNotes; }
  public UUID getUserId() { return userId; }
  public UUID getAssignedAdmin() { return assignedAdmin; }
  public Instant getCreatedAt() { return createdAt; }

  public void setStatus(String status) { this.status = status; }
  public void setPriority(String priority) { this.priority = priority; }
  public void setResolutionNotes(String resolutionNotes) { this.resolutionNotes = resolutionNotes; }
  public void setAssignedAdmin(UUID assignedAdmin) { this.assignedAdmin = assignedAdmin; }
}
