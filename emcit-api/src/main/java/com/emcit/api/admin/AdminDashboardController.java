package com.emcit.api.admin;

import com.emcit.api.security.SecurityActor;
import com.emcit.api.ticket.TicketController.TicketRow;
import com.emcit.api.vault.VaultController.LicenseView;
import com.emcit.application.guard.AccessGate;
import com.emcit.application.vault.CredentialVault;
import com.emcit.domain.access.Actor;
import com.emcit.infrastructure.asset.AssetRepository;
import com.emcit.infrastructure.ticket.TicketEntity;
import com.emcit.infrastructure.ticket.TicketRepository;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class AdminDashboardController {

  static final int RENEWAL_WINDOW_DAYS = 30;

  private final TicketRepository tickets;
  private final AssetRepository assets;
  private final CredentialVault vault;

  public AdminDashboardController(TicketRepository tickets, AssetRepository assets, CredentialVault vault) {
    this.tickets = tickets;
    this.assets = assets;
    this.vault = vault;
  }

  public record Kpis(long totalTickets, long openTickets, long criticalTickets, long totalAssets) {}

  public record Dashboard(Kpis kpis, List<TicketRow> recentTickets, List<LicenseView> renewalAlerts) {}

  @GetMapping("/api/v1/admin/dashboard")
  public Dashboard dashboard() {
    Actor actor = AccessGate.require(SecurityActor.current(), AccessGate.ADMINS);
    var kpis = new Kpis(
        tickets.count(),
        tickets.countByStatus(TicketEntity.STATUS_OPEN),
        tickets.countByPriorityAndStatusNot(TicketEntity.PRIORITY_CRITICAL, TicketEntity.STATUS_CLOSED),
        assets.count()
    );
    return new Dashboard(
        kpis,
        tickets.findTop10ByOrderByCreatedAtDesc().stream().map(TicketRow::of).toList(),
        vault.expiringWithin(actor, RENEWAL_WINDOW_DAYS).stream().map(LicenseView::of).toList()
    );
  }
}
