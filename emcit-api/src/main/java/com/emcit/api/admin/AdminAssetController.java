package com.emcit.api.admin;

import com.emcit.api.security.SecurityActor;
import com.emcit.api.tracing.RequestContext;
import com.emcit.application.audit.AuditActions;
import com.emcit.application.audit.AuditRecorder;
import com.emcit.application.guard.AccessGate;
import com.emcit.domain.access.Actor;
import com.emcit.domain.asset.AssetIds;
import com.emcit.domain.asset.TechnicalSpecs;
import com.emcit.infrastructure.asset.AssetEntity;
import com.emcit.infrastructure.asset.AssetRepository;
import com.emcit.infrastructure.user.UserRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.Year;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/assets")
public class AdminAssetController {

  private final AssetRepository assets;
  private final UserRepository users;
  private final AuditRecorder audit;
  private final Clock clock;

  public AdminAssetController(AssetRepository assets, UserRepository users, AuditRecorder audit, Clock clock) {
    this.assets = assets;
    this.users = users;
    this.audit = audit;
    this.clock = clock;
  }

  public record CreateAssetRequest(
      @NotBlank String category,
      @NotBlank String assetName,
      String brand,
      String model,
      String serialNumber,
      String assetTag,
      String location,
      @PositiveOrZero Integer quantity,
      LocalDate purchaseDate,
      LocalDate invoiceDate,
      String invoiceNumber,
      String vendorName,
      LocalDate warrantyExpiry,
      @PositiveOrZero BigDecimal baseAmount,
      @PositiveOrZero BigDecimal gstAmount,
      String ownership,
      String status,
      String department,
      String remarks,
      UUID assignedTo,
      Map<String, String> technicalSpecs
  ) {}

  public record AssetRow(
      UUID id,
      String assetId,
      String category,
      String assetName,
      String brand,
      String model,
      String serialNumber,
      String assetTag,
      String location,
      int quantity,
      LocalDate purchaseDate,
      LocalDate invoiceDate,
      String invoiceNumber,
      String vendorName,
      LocalDate warrantyExpiry,
      BigDecimal baseAmount,
      BigDecimal gstAmount,
      BigDecimal totalAmount,
      String ownership,
      String status,
      String department,
      String remarks,
      UUID assignedTo,
      Map<String, String> technicalSpecs,
      String createdAt
  ) {
    public static AssetRow of(AssetEntity a) {
      return new AssetRow(
          a.getId(),
          a.getAssetId(),
          a.getCategory(),
          a.getAssetName(),
          a.getBrand(),
          a.getModel(),
          a.getSerialNumber(),
          a.getAssetTag(),
          a.getLocation(),
          a.getQuantity(),
          a.getPurchaseDate(),
          a.getInvoiceDate(),
          a.getInvoiceNumber(),
          a.getVendorName(),
          a.getWarrantyExpiry(),
          a.getBaseAmount(),
          a.getGstAmount(),
          a.getTotalAmount(),
          a.getOwnership(),
          a.getStatus(),
          a.getDepartment(),
          a.getRemarks(),
          a.getAssignedTo(),
          a.getTechnicalSpecs(),
          a.getCreatedAt() == null ? null : a.getCreatedAt().toString()
      );
    }
  }

  @GetMapping
  public List<AssetRow> list() {
    AccessGate.require(SecurityActor.current(), AccessGate.ADMINS);
    return assets.findAllByOrderByCreatedAtDesc().stream().map(AssetRow::of).toList();
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  @Transactional
  public AssetRow create(@Valid @RequestBody CreateAssetRequest req) {
    Actor actor = AccessGate.require(SecurityActor.current(), AccessGate.ADMINS);
    if (req.assignedTo() != null && !users.existsById(req.assignedTo())) {
      throw new IllegalArgumentException("assignedTo: unknown user");
    }

    String assetId = AssetIds.next(Year.now(clock), assets.count());
    AssetEntity a = new AssetEntity(UUID.randomUUID(), assetId, req.category().trim(), req.assetName().trim());
    a.setBrand(req.brand());
    a.setModel(req.model());
    a.setSerialNumber(req.serialNumber());
    a.setAssetTag(req.assetTag());
    a.setLocation(req.location());
    a.setQuantity(req.quantity() == null ? 1 : req.quantity());
    a.setPurchaseDate(req.purchaseDate());
    a.setInvoiceDate(req.invoiceDate());
    a.setInvoiceNumber(req.invoiceNumber());
    a.setVendorName(req.vendorName());
    a.setWarrantyExpiry(req.warrantyExpiry());
    a.setAmounts(req.baseAmount(), req.gstAmount());
    if (req.ownership() != null && !req.ownership().isBlank()) a.setOwnership(req.ownership().trim());
    if (req.status() != null && !req.status().isBlank()) a.setStatus(req.status().trim());
    a.setDepartment(req.department());
    a.setRemarks(req.remarks());
    a.setAssignedTo(req.assignedTo());
    a.setTechnicalSpecs(TechnicalSpecs.capture(req.technicalSpecs()).asMap());

    AssetEntity saved = assets.save(a);
    audit.record(actor, AuditActions.ASSET_CREATE, AuditActions.target("asset", assetId), RequestContext.originAddress());
    return AssetRow.of(saved);
  }
}
