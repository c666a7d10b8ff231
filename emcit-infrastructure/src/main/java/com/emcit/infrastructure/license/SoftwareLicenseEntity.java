package com.emcit.infrastructure.license;

import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(
    name = "software_licenses",
    indexes = @Index(name = "ix_software_licenses_renewal", columnList = "renewal_date")
)
public class SoftwareLicenseEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "software_name", nullable = false, length = 200)
  private String softwareName;

  @Column(name = "license_type", nullable = false, length = 100)
  private String licenseType;

  @Column(name = "vendor_name", length = 200)
  private String vendorName;

  @Column(name = "purchase_date")
  private LocalDate purchaseDate;

  @Column(name = "activation_date")
  private LocalDate activationDate;

  @Column(name = "renewal_date")
  private LocalDate renewalDate;

  @Column(name = "login_username", length = 200)
  private String loginUsername;

  // encrypted tokens, never plaintext
  @Column(name = "login_password_enc", length = 2048)
  private String loginPasswordEnc;

  @Column(name = "product_key_enc", nullable = false, length = 2048)
  private String productKeyEnc;

  @Column(name = "cost", length = 64)
  private String cost;

  @Column(name = "user_strength")
  private Integer userStrength;

  @Column(name = "created_by")
  private UUID createdBy;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected SoftwareLicenseEntity() {}

  public SoftwareLicenseEntity(UUID id, String softwareName, String licenseType, String vendorName,
                               LocalDate purchaseDate, LocalDate activationDate, LocalDate renewalDate,
                               String loginUsername, String loginPasswordEnc, String productKeyEnc,
                               String cost, Integer userStrength, UUID createdBy, Instant createdAt) {
    this.id = id;
    this.softwareName = softwareName;
    this.licenseType = licenseType;
    this.vendorName = vendorName;
    this.purchaseDate = purchaseDate;
    this.activationDate = activationDate;
    this.renewalDate = renewalDate;
    this.loginUsername = loginUsername;
    this.loginPasswordEnc = loginPasswordEnc;
    this.productKeyEnc = productKeyEnc;
    this.cost = cost;
    this.userStrength = userStrength;
    this.createdBy = createdBy;
    this.createdAt = createdAt;
  }

  public UUID getId() { return id; }
  public String getSoftwareName() { return softwareName; }
  public String getLicenseType() { return licenseType; }
  public String getVendorName() { return vendorName; }
  public LocalDate getPurchaseDate() { return purchaseDate; }
  public LocalDate getActivationDate() { return activationDate; }
  public LocalDate getRenewalDate() { return renewalDate; }
  public String getLoginUsername() { return loginUsername; }
  public String getLoginPasswordEnc() { return loginPasswordEnc; }
  public String getProductKeyEnc() { return productKeyEnc; }
  public String getCost() { return cost; }
  public Integer getUserStrength() { return userStrength; }
  public UUID getCreatedBy() { return createdBy; }
  public Instant getCreatedAt() { return createdAt; }
}
