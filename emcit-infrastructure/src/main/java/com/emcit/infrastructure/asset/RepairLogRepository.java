package com.emcit.infrastructure.asset;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface RepairLogRepository extends JpaRepository<RepairLogEntity, UUID> {

  List<RepairLogEntity> findAllByOrderByRepairDateDesc();
}
