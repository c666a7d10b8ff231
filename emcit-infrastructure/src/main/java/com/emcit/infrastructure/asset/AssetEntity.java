package com.emcit.infrastructure.asset;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

@Entity
@Table(
    name = "assets",
    uniqueConstraints = @UniqueConstraint(name = "uk_assets_asset_id", columnNames = "asset_id"),
    indexes = @Index(name = "ix_assets_assigned_to", columnList = "assigned_to")
)
public class AssetEntity {

  public static final String DEFAULT_OWNERSHIP = "Company Owned";
  public static final String DEFAULT_STATUS = "In Stock";

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "asset_id", nullable = false, length = 32)
  private String assetId;

  @Column(name = "category", nullable = false, length = 80)
  private String category;

  @Column(name = "asset_name", nullable = false, length = 200)
  private String assetName;

  @Column(name = "brand", length = 120)
  private String brand;

  @Column(name = "model", length = 120)
  private String model;

  @Column(name = "serial_number", length = 120)
  private String serialNumber;

  @Column(name = "asset_tag", length = 120)
  private String assetTag;

  @Column(name = "location", length = 200)
  private String location;

  @Column(name = "quantity", nullable = false)
  private int quantity = 1;

  @Column(name = "purchase_date")
  private LocalDate purchaseDate;

  @Column(name = "invoice_date")
  private LocalDate invoiceDate;

  @Column(name = "invoice_number", length = 120)
  private String invoiceNumber;

  @Column(name = "vendor_name", length = 200)
  private String vendorName;

  @Column(name = "warranty_expiry")
  private LocalDate warrantyExpiry;

  @Column(name = "base_amount", nullable = false, precision = 14, scale = 2)
  private BigDecimal baseAmount = BigDecimal.ZERO;

  @Column(name = "gst_amount", nullable = false, precision = 14, scale = 2)
  private BigDecimal gstAmount = BigDecimal.ZERO;

  @Column(name = "total_amount", nullable = false, precision = 14, scale = 2)
  private BigDecimal totalAmount = BigDecimal.ZERO;

  @Column(name = "ownership", nullable = false, length = 64)
  private String ownership = DEFAULT_OWNERSHIP;

  @Column(name = "status", nullable = false, length = 64)
  private String status = DEFAULT_STATUS;

  @Column(name = "department", length = 120)
  private String department;

  @Column(name = "remarks", length = 4000)
  private String remarks;

  @Column(name = "assigned_to")
  private UUID assignedTo;

  @Convert(converter = TechnicalSpecsConverter.class)
  @Column(name = "technical_specs", length = 8000)
  private Map<String, String> technicalSpecs = new TreeMap<>();

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected AssetEntity() {}

  public AssetEntity(UUID id, String assetId, String category, String assetName) {
    this.id = id;
    this.assetId = assetId;
    this.category = category;
    this.assetName = assetName;
  }

  @PrePersist
  void prePersist() {
    if (createdAt == null) createdAt = Instant.now();
  }

  /** total = base + GST; missing amounts count as zero. */
  public void setAmounts(BigDecimal base, BigDecimal gst) {
    this.baseAmount = base == null ? BigDecimal.ZERO : base;
    this.gstAmount = gst == null ? BigDecimal.ZERO : gst;
    this.totalAmount = this.baseAmount.add(this.gstAmount);
  }

  public UUID getId() { return id; }
  public String getAssetId() { return assetId; }
  public String getCategory() { return category; }
  public String getAssetName() { return assetName; }
  public String getBrand() { return brand; }
  public String getModel() { return model; }
  public String getSerialNumber() { return serialNumber; }
  public String getAssetTag() { return assetTag; }
  public String getLocation() { return location; }
  public int getQuantity() { return quantity; }
  public LocalDate getPurchaseDate() { return purchaseDate; }
  public LocalDate getInvoiceDate() { return invoiceDate; }
  public String getInvoiceNumber() { return invoiceNumber; }
  public String getVendorName() { return vendorName; }
  public LocalDate getWarrantyExpiry() { return warrantyExpiry; }
  public BigDecimal getBaseAmount() { return baseAmount; }
  public BigDecimal getGstAmount() { return gstAmount; }
  public BigDecimal getTotalAmount() { return totalAmount; }
  public String getOwnership() { return ownership; }
  public String getStatus() { return status; }
  public String getDepartment() { return department; }
  public String getRemarks() { return remarks; }
  public UUID getAssignedTo() { return assignedTo; }
  public Map<String, String> getTechnicalSpecs() { return technicalSpecs; }
  public Instant getCreatedAt() { return createdAt; }

  public void setBrand(String brand) { this.brand = brand; }
  public void setModel(String model) { this.model = model; }
  public void setSerialNumber(String serialNumber) { this.serialNumber = serialNumber; }
  public void setAssetTag(String assetTag) { this.assetTag = assetTag; }
  public void setLocation(String location) { this.location = location; }
  public void setQuantity(int quantity) { this.quantity = quantity; }
  public void setPurchaseDate(LocalDate purchaseDate) { this.purchaseDate = purchaseDate; }
  public void setInvoiceDate(LocalDate invoiceDate) { this.invoiceDate = invoiceDate; }
  public void setInvoiceNumber(String invoiceNumber) { this.invoiceNumber = invoiceNumber; }
  public void setVendorName(String vendorName) { this.vendorName = vendorName; }
  public void setWarrantyExpiry(LocalDate warrantyExpiry) { this.warrantyExpiry = warrantyExpiry; }
  public void setOwnership(String ownership) { this.ownership = ownership; }
  public void setStatus(String status) { this.status = status; }
  public void setDepartment(String department) { this.department = department; }
  public void setRemarks(String remarks) { this.remarks = remarks; }
  public void setAssignedTo(UUID assignedTo) { this.assignedTo = assignedTo; }
  public void setTechnicalSpecs(Map<String, String> technicalSpecs) {
    this.technicalSpecs = technicalSpecs == null ? new TreeMap<>() : new TreeMap<>(technicalSpecs);
  }
}
