package com.emcit.api.admin;

import com.emcit.api.security.SecurityActor;
import com.emcit.application.guard.AccessGate;
import com.emcit.infrastructure.consumable.ConsumableEntity;
import com.emcit.infrastructure.consumable.ConsumableRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/consumables")
public class AdminConsumableController {

  private final ConsumableRepository consumables;
  private final Clock clock;

  public AdminConsumableController(ConsumableRepository consumables, Clock clock) {
    this.consumables = consumables;
    this.clock = clock;
  }

  public record CreateConsumableRequest(
      @NotBlank String itemName,
      String category,
      @NotNull @PositiveOrZero Integer quantity,
      @PositiveOrZero Integer thresholdLimit
  ) {}

  public record ConsumableRow(
      UUID id,
      String itemName,
      String category,
      int totalQuantity,
      int remainingQuantity,
      int thresholdLimit,
      boolean lowStock,
      String lastRestocked
  ) {
    static ConsumableRow of(ConsumableEntity c) {
      return new ConsumableRow(
          c.getId(),
          c.getItemName(),
          c.getCategory(),
          c.getTotalQuantity(),
          c.getRemainingQuantity(),
          c.getThresholdLimit(),
          c.isLowStock(),
          c.getLastRestocked() == null ? null : c.getLastRestocked().toString()
      );
    }
  }

  @GetMapping
  public List<ConsumableRow> list() {
    AccessGate.require(SecurityActor.current(), AccessGate.ADMINS);
    return consumables.findAllByOrderByItemNameAsc().stream().map(ConsumableRow::of).toList();
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public ConsumableRow create(@Valid @RequestBody CreateConsumableRequest req) {
    AccessGate.require(SecurityActor.current(), AccessGate.ADMINS);
    int threshold = req.thresholdLimit() == null ? ConsumableEntity.DEFAULT_THRESHOLD : req.thresholdLimit();
    ConsumableEntity saved = consumables.save(new ConsumableEntity(
        UUID.randomUUID(),
        req.itemName().trim(),
        req.category(),
        req.quantity(),
        threshold,
        clock.instant()
    ));
    return ConsumableRow.of(saved);
  }
}
