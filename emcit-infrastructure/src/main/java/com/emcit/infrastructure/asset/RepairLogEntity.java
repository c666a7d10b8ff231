package com.emcit.infrastructure.asset;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "repair_logs", indexes = @Index(name = "ix_repair_logs_asset", columnList = "asset_id"))
public class RepairLogEntity {

  public static final String STATUS_IN_PROGRESS = "In Progress";

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "asset_id", nullable = false)
  private UUID assetId;

  @Column(name = "issue_reported", nullable = false, length = 1000)
  private String issueReported;

  @Column(name = "vendor_name", length = 200)
  private String vendorName;

  @Column(name = "repair_cost", nullable = false, precision = 14, scale = 2)
  private BigDecimal repairCost;

  @Column(name = "repair_date", nullable = false)
  private Instant repairDate;

  @Column(name = "status", nullable = false, length = 32)
  private String status;

  @Column(name = "remarks", length = 4000)
  private String remarks;

  protected RepairLogEntity() {}

  public RepairLogEntity(UUID id, UUID assetId, String issueReported, String vendorName,
                         BigDecimal repairCost, String remarks, Instant repairDate) {
    this.id = id;
    this.assetId = assetId;
    this.issueReported = issueReported;
    this.vendorName = vendorName;
    this.repairCost = repairCost == null ? BigDecimal.ZERO : repairCost;
    this.remarks = remarks;
    this.repairDate = repairDate;
    this.status = STATUS_IN_PROGRESS;
  }

  public UUID getId() { return id; }
  public UUID getAssetId() { return assetId; }
  public String getIssueReported() { return issueReported; }
  public String getVendorName() { return vendorName; }
  public BigDecimal getRepairCost() { return repairCost; }
  public Instant getRepairDate() { return repairDate; }
  public String getStatus() { return status; }
  public String getRemarks() { return remarks; }

  public void setStatus(String status) { this.status = status; }
}
