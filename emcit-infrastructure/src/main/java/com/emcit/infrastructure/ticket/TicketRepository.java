package com.emcit.infrastructure.ticket;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface TicketRepository extends JpaRepository<TicketEntity, UUID> {

  List<TicketEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);

  List<TicketEntity> findTop10ByOrderByCreatedAtDesc();

  boolean existsByTicketUid(String ticketUid);

  long countByStatus(String status);

  long countByPriorityAndStatusNot(String priority, String status);
}
