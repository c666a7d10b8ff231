package com.emcit.infrastructure.license;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public interface SoftwareLicenseJpaRepository extends JpaRepository<SoftwareLicenseEntity, UUID> {

  List<SoftwareLicenseEntity> findAllByOrderByCreatedAtDesc();

  List<SoftwareLicenseEntity> findByRenewalDateBetweenOrderByRenewalDateAsc(LocalDate from, LocalDate to);
}
