package com.emcit.infrastructure.license;

import com.emcit.application.ports.LicenseRepository;
import com.emcit.domain.vault.LicenseFields;
import com.emcit.domain.vault.LicenseRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter: stores vault records in {@code software_licenses}.
 * Secret columns hold the encrypted tokens exactly as produced by the vault.
 */
@Component
public class JpaLicenseRepositoryAdapter implements LicenseRepository {

  private final SoftwareLicenseJpaRepository rows;

  public JpaLicenseRepositoryAdapter(SoftwareLicenseJpaRepository rows) {
    this.rows = rows;
  }

  @Override
  public LicenseRecord save(LicenseRecord record) {
    return toRecord(rows.save(toEntity(record)));
  }

  @Override
  public Optional<LicenseRecord> findById(UUID id) {
    return rows.findById(id).map(JpaLicenseRepositoryAdapter::toRecord);
  }

  @Override
  public List<LicenseRecord> findAll() {
    return rows.findAllByOrderByCreatedAtDesc().stream().map(JpaLicenseRepositoryAdapter::toRecord).toList();
  }

  @Override
  public List<LicenseRecord> findRenewingBetween(LocalDate from, LocalDate to) {
    return rows.findByRenewalDateBetweenOrderByRenewalDateAsc(from, to).stream()
        .map(JpaLicenseRepositoryAdapter::toRecord)
        .toList();
  }

  static SoftwareLicenseEntity toEntity(LicenseRecord r) {
    LicenseFields f = r.fields();
    return new SoftwareLicenseEntity(
        r.id(),
        f.softwareName(),
        f.licenseType(),
        f.vendorName(),
        f.purchaseDate(),
        f.activationDate(),
        f.renewalDate(),
        f.loginUsername(),
        r.loginPasswordToken(),
        r.productKeyToken(),
        f.cost(),
        f.userStrength(),
        r.createdBy(),
        r.createdAt()
    );
  }

  static LicenseRecord toRecord(SoftwareLicenseEntity e) {
    return new LicenseRecord(
        e.getId(),
        new LicenseFields(
            e.getSoftwareName(),
            e.getLicenseType(),
            e.getVendorName(),
            e.getPurchaseDate(),
            e.getActivationDate(),
            e.getRenewalDate(),
            e.getLoginUsername(),
            e.getCost(),
            e.getUserStrength()
        ),
        e.getProductKeyEnc(),
        e.getLoginPasswordEnc(),
        e.getCreatedBy(),
        e.getCreatedAt()
    );
  }
}
