package com.emcit.api.metrics;

import com.emcit.infrastructure.ticket.TicketEntity;
import com.emcit.infrastructure.ticket.TicketRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Operational metrics.
 *
 * Exposes:
 * - emcit.vault.reveals.granted / emcit.vault.reveals.denied (counters)
 * - emcit.tickets.open (gauge)
 */
@Component
public class VaultMetrics {

  private final Counter revealsGranted;
  private final Counter revealsDenied;

  public VaultMetrics(MeterRegistry registry, TicketRepository tickets) {
    registry.gauge("emcit.tickets.open", tickets, r -> r.countByStatus(TicketEntity.STATUS_OPEN));

    this.revealsGranted = Counter.builder("emcit.vault.reveals.granted")
        .description("License secrets revealed")
        .register(registry);
    this.revealsDenied = Counter.builder("emcit.vault.reveals.denied")
        .description("Reveal attempts refused by role, challenge or lookup")
        .register(registry);
  }

  public void incGranted() {
    revealsGranted.increment();
  }

  public void incDenied() {
    revealsDenied.increment();
  }
}
