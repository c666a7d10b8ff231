package com.emcit.domain.vault;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Stored license. {@code productKeyToken} and {@code loginPasswordToken} are encrypted tokens
 * and are only opened by the vault reveal path.
 */
public record LicenseRecord(
        UUID id,
        LicenseFields fields,
        String productKeyToken,
        String loginPasswordToken,
        UUID createdBy,
        Instant createdAt
) {
    public LicenseRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(productKeyToken, "productKeyToken");
    }

    public boolean hasLoginPassword() {
        return loginPasswordToken != null;
    }

    @Override
    public String toString() {
        return "LicenseRecord[id=" + id + ", software=" + fields.softwareName() + "]";
    }
}
