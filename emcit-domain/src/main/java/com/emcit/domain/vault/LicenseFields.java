package com.emcit.domain.vault;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Plaintext descriptive fields of a software license.
 */
public record LicenseFields(
        String softwareName,
        String licenseType,
        String vendorName,
        LocalDate purchaseDate,
        LocalDate activationDate,
        LocalDate renewalDate,
        String loginUsername,
        String cost,
        Integer userStrength
) {
    public LicenseFields {
        Objects.requireNonNull(softwareName, "softwareName");
        Objects.requireNonNull(licenseType, "licenseType");
        if (softwareName.isBlank()) throw new IllegalArgumentException("softwareName is blank");
        if (licenseType.isBlank()) throw new IllegalArgumentException("licenseType is blank");
    }
}
