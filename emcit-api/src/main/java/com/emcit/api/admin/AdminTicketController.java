package com.emcit.api.admin;

import com.emcit.api.security.SecurityActor;
import com.emcit.api.ticket.TicketController.TicketRow;
import com.emcit.api.tracing.RequestContext;
import com.emcit.application.audit.AuditActions;
import com.emcit.application.audit.AuditRecorder;
import com.emcit.application.guard.AccessGate;
import com.emcit.domain.access.Actor;
import com.emcit.domain.vault.RecordNotFoundException;
import com.emcit.infrastructure.ticket.TicketEntity;
import com.emcit.infrastructure.ticket.TicketRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import org.springframework.data.domain.Sort;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/tickets")
public class AdminTicketController {

  private final TicketRepository tickets;
  private final AuditRecorder audit;

  public AdminTicketController(TicketRepository tickets, AuditRecorder audit) {
    this.tickets = tickets;
    this.audit = audit;
  }

  public record UpdateTicketRequest(
      @Size(max = 32) String status,
      @Size(max = 32) String priority,
      @Size(max = 8000) String resolutionNotes
  ) {}

  @GetMapping
  public List<TicketRow> list() {
    AccessGate.require(SecurityActor.current(), AccessGate.ADMINS);
    return tickets.findAll(Sort.by(Sort.Direction.DESC, "createdAt")).stream().map(TicketRow::of).toList();
  }

  /** Applies the given fields and takes ownership of the ticket for the acting admin. */
  @PutMapping("/{id}")
  @Transactional
  public TicketRow update(@PathVariable UUID id, @Valid @RequestBody UpdateTicketRequest req) {
    Actor actor = AccessGate.require(SecurityActor.current(), AccessGate.ADMINS);
    TicketEntity t = tickets.findById(id)
        .orElseThrow(() -> new RecordNotFoundException(AuditActions.target("ticket", id)));

    if (req.status() != null && !req.status().isBlank()) t.setStatus(req.status().trim());
    if (req.priority() != null && !req.priority().isBlank()) t.setPriority(req.priority().trim());
    if (req.resolutionNotes() != null) t.setResolutionNotes(req.resolutionNotes());
    t.setAssignedAdmin(actor.userId());
    tickets.save(t);

    audit.record(actor, AuditActions.UPDATE_TICKET, AuditActions.target("ticket", t.getTicketUid()), RequestContext.originAddress());
    return TicketRow.of(t);
  }
}
