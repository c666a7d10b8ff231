package com.emcit.application.ports;

import com.emcit.domain.vault.LicenseRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface LicenseRepository {

    LicenseRecord save(LicenseRecord record);

    Optional<LicenseRecord> findById(UUID id);

    List<LicenseRecord> findAll();

    /** Licenses whose renewal date lies in [from, to], soonest first. */
    List<LicenseRecord> findRenewingBetween(LocalDate from, LocalDate to);
}
