package com.emcit.api.ticket;

import com.emcit.api.security.SecurityActor;
import com.emcit.api.tracing.RequestContext;
import com.emcit.application.audit.AuditActions;
import com.emcit.application.audit.AuditRecorder;
import com.emcit.application.guard.AccessGate;
import com.emcit.domain.access.Actor;
import com.emcit.infrastructure.ticket.TicketEntity;
import com.emcit.infrastructure.ticket.TicketRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Helpdesk tickets raised by any signed-in user. */
@RestController
@RequestMapping("/api/v1/tickets")
public class TicketController {

  static final String DEFAULT_PRIORITY = "Medium";

  private final TicketRepository tickets;
  private final AuditRecorder audit;
  private final Clock clock;

  public TicketController(TicketRepository tickets, AuditRecorder audit, Clock clock) {
    this.tickets = tickets;
    this.audit = audit;
    this.clock = clock;
  }

  public record CreateTicketRequest(
      @NotBlank @Size(max = 200) String title,
      @NotBlank @Size(max = 8000) String description,
      String category,
      String priority,
      @Size(max = 1024) String attachmentUrl
  ) {}

  public record TicketRow(
      UUID id,
      String ticketUid,
      String title,
      String description,
      String category,
      String priority,
      String status,
      String attachmentUrl,
      String resolutionNotes,
      UUID userId,
      UUID assignedAdmin,
      String createdAt
  ) {
    public static TicketRow of(TicketEntity t) {
      return new TicketRow(
          t.getId(),
          t.getTicketUid(),
          t.getTitle(),
          t.getDescription(),
          t.getCategory(),
          t.getPriority(),
          t.getStatus(),
          t.getAttachmentUrl(),
          t.getResolutionNotes(),
          t.getUserId(),
          t.getAssignedAdmin(),
          t.getCreatedAt() == null ? null : t.getCreatedAt().toString()
      );
    }
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  @Transactional
  public TicketRow create(@Valid @RequestBody CreateTicketRequest req) {
    Actor actor = AccessGate.require(SecurityActor.current(), AccessGate.ANY_ROLE);
    Instant now = clock.instant();
    String priority = req.priority() == null || req.priority().isBlank() ? DEFAULT_PRIORITY : req.priority().trim();

    TicketEntity t = new TicketEntity(
        UUID.randomUUID(),
        nextUid(now),
        req.title().trim(),
        req.description(),
        req.category(),
        priority,
        req.attachmentUrl(),
        actor.userId(),
        now
    );
    tickets.save(t);
    audit.record(actor, AuditActions.CREATE_TICKET, AuditActions.target("ticket", t.getTicketUid()), RequestContext.originAddress());
    return TicketRow.of(t);
  }

  @GetMapping("/mine")
  public List<TicketRow> mine() {
    Actor actor = AccessGate.require(SecurityActor.current(), AccessGate.ANY_ROLE);
    return tickets.findByUserIdOrderByCreatedAtDesc(actor.userId()).stream().map(TicketRow::of).toList();
  }

  // TKT-<epochSeconds>, with -2, -3... when several tickets land in the same second
  private String nextUid(Instant now) {
    String base = "TKT-" + now.getEpochSecond();
    String uid = base;
    for (int n = 2; tickets.existsByTicketUid(uid); n++) {
      uid = base + "-" + n;
    }
    return uid;
  }
}
