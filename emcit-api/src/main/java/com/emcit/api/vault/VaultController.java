package com.emcit.api.vault;

import com.emcit.api.metrics.VaultMetrics;
import com.emcit.api.security.SecurityActor;
import com.emcit.api.tracing.RequestContext;
import com.emcit.application.vault.CredentialVault;
import com.emcit.domain.DomainException;
import com.emcit.domain.vault.LicenseFields;
import com.emcit.domain.vault.LicenseRecord;
import com.emcit.domain.vault.RevealedSecrets;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Software-license vault.
 *
 * Listing never includes product keys or passwords; the only way to read them is
 * {@code POST /reveal} with a solved challenge.
 */
@RestController
@RequestMapping("/api/v1/vault")
public class VaultController {

  private final CredentialVault vault;
  private final VaultMetrics metrics;

  public VaultController(CredentialVault vault, VaultMetrics metrics) {
    this.vault = vault;
    this.metrics = metrics;
  }

  public record CreateLicenseRequest(
      @NotBlank String softwareName,
      @NotBlank String licenseType,
      String vendorName,
      LocalDate purchaseDate,
      LocalDate activationDate,
      LocalDate renewalDate,
      String loginUsername,
      String loginPassword,
      @NotBlank String productKey,
      String cost,
      @PositiveOrZero Integer userStrength
  ) {
    @Override
    public String toString() {
      return "CreateLicenseRequest[softwareName=" + softwareName + ", secrets=****]";
    }
  }

  public record LicenseView(
      UUID id,
      String softwareName,
      String licenseType,
      String vendorName,
      LocalDate purchaseDate,
      LocalDate activationDate,
      LocalDate renewalDate,
      String loginUsername,
      boolean hasLoginPassword,
      String cost,
      Integer userStrength,
      UUID createdBy,
      String createdAt
  ) {
    public static LicenseView of(LicenseRecord r) {
      LicenseFields f = r.fields();
      return new LicenseView(
          r.id(),
          f.softwareName(),
          f.licenseType(),
          f.vendorName(),
          f.purchaseDate(),
          f.activationDate(),
          f.renewalDate(),
          f.loginUsername(),
          r.hasLoginPassword(),
          f.cost(),
          f.userStrength(),
          r.createdBy(),
          r.createdAt() == null ? null : r.createdAt().toString()
      );
    }
  }

  // Not @Valid: malformed input must fall through the gate and the challenge like any other reveal.
  public record RevealRequest(String licenseId, String captchaInput, String captchaToken) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record RevealResponse(
      @JsonProperty("product_key") String productKey,
      @JsonProperty("password") String password
  ) {
    @Override
    public String toString() {
      return "RevealResponse[****]";
    }
  }

  @GetMapping("/licenses")
  public List<LicenseView> list() {
    return vault.list(SecurityActor.current()).stream().map(LicenseView::of).toList();
  }

  @GetMapping("/licenses/expiring")
  public List<LicenseView> expiring(@RequestParam(defaultValue = "30") int days) {
    return vault.expiringWithin(SecurityActor.current(), days).stream().map(LicenseView::of).toList();
  }

  @PostMapping(value = "/licenses", produces = MediaType.APPLICATION_JSON_VALUE)
  @ResponseStatus(HttpStatus.CREATED)
  public Map<String, Object> create(@Valid @RequestBody CreateLicenseRequest req) {
    var fields = new LicenseFields(
        req.softwareName().trim(),
        req.licenseType().trim(),
        req.vendorName(),
        req.purchaseDate(),
        req.activationDate(),
        req.renewalDate(),
        req.loginUsername(),
        req.cost(),
        req.userStrength()
    );
    LicenseRecord saved = vault.create(
        SecurityActor.current(),
        fields,
        req.productKey(),
        req.loginPassword(),
        RequestContext.originAddress()
    );
    return Map.of("id", saved.id().toString());
  }

  @PostMapping(value = "/reveal", produces = MediaType.APPLICATION_JSON_VALUE)
  public RevealResponse reveal(@RequestBody RevealRequest req) {
    RevealedSecrets secrets;
    try {
      secrets = vault.reveal(
          parseUuidOrNull(req.licenseId()),
          req.captchaInput(),
          req.captchaToken(),
          SecurityActor.current(),
          RequestContext.originAddress()
      );
    } catch (DomainException e) {
      metrics.incDenied();
      throw e;
    }
    metrics.incGranted();
    return new RevealResponse(secrets.productKey(), secrets.password());
  }

  private static UUID parseUuidOrNull(String value) {
    if (value == null || value.isBlank()) return null;
    try {
      return UUID.fromString(value.trim());
    } catch (IllegalArgumentException ignored) {
      return null;
    }
  }
}
