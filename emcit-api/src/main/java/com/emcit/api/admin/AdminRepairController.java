package com.emcit.api.admin;

import com.emcit.api.security.SecurityActor;
import com.emcit.application.audit.AuditActions;
import com.emcit.application.guard.AccessGate;
import com.emcit.domain.vault.RecordNotFoundException;
import com.emcit.infrastructure.asset.AssetRepository;
import com.emcit.infrastructure.asset.RepairLogEntity;
import com.emcit.infrastructure.asset.RepairLogRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/repairs")
public class AdminRepairController {

  private final RepairLogRepository repairs;
  private final AssetRepository assets;
  private final Clock clock;

  public AdminRepairController(RepairLogRepository repairs, AssetRepository assets, Clock clock) {
    this.repairs = repairs;
    this.assets = assets;
    this.clock = clock;
  }

  public record CreateRepairRequest(
      @NotNull UUID assetId,
      @NotBlank String issueReported,
      String vendorName,
      @PositiveOrZero BigDecimal repairCost,
      String remarks
  ) {}

  public record RepairRow(
      UUID id,
      UUID assetId,
      String issueReported,
      String vendorName,
      BigDecimal repairCost,
      String repairDate,
      String status,
      String remarks
  ) {
    static RepairRow of(RepairLogEntity r) {
      return new RepairRow(
          r.getId(),
          r.getAssetId(),
          r.getIssueReported(),
          r.getVendorName(),
          r.getRepairCost(),
          r.getRepairDate() == null ? null : r.getRepairDate().toString(),
          r.getStatus(),
          r.getRemarks()
      );
    }
  }

  @GetMapping
  public List<RepairRow> list() {
    AccessGate.require(SecurityActor.current(), AccessGate.ADMINS);
    return repairs.findAllByOrderByRepairDateDesc().stream().map(RepairRow::of).toList();
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public RepairRow create(@Valid @RequestBody CreateRepairRequest req) {
    AccessGate.require(SecurityActor.current(), AccessGate.ADMINS);
    if (!assets.existsById(req.assetId())) {
      throw new RecordNotFoundException(AuditActions.target("asset", req.assetId()));
    }
    RepairLogEntity saved = repairs.save(new RepairLogEntity(
        UUID.randomUUID(),
        req.assetId(),
        req.issueReported().trim(),
        req.vendorName(),
        req.repairCost(),
        req.remarks(),
        clock.instant()
    ));
    return RepairRow.of(saved);
  }
}
