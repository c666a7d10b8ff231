package com.emcit.infrastructure.consumable;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "consumables")
public class ConsumableEntity {

  public static final int DEFAULT_THRESHOLD = 5;

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "item_name", nullable = false, length = 200)
  private String itemName;

  // Ink, Toner, Battery, ...
  @Column(name = "category", nullable = false, length = 80)
  private String category;

  @Column(name = "total_quantity", nullable = false)
  private int totalQuantity;

  @Column(name = "remaining_quantity", nullable = false)
  private int remainingQuantity;

  @Column(name = "last_restocked", nullable = false)
  private Instant lastRestocked;

  @Column(name = "threshold_limit", nullable = false)
  private int thresholdLimit;

  protected ConsumableEntity() {}

  public ConsumableEntity(UUID id, String itemName, String category, int quantity, int thresholdLimit,
                          Instant restockedAt) {
    this.id = id;
    this.itemName = itemName;
    this.category = category;
    this.totalQuantity = quantity;
    this.remainingQuantity = quantity;
    this.thresholdLimit = thresholdLimit;
    this.lastRestocked = restockedAt;
  }

  public boolean isLowStock() {
    return remainingQuantity <= thresholdLimit;
  }

  public UUID getId() { return id; }
  public String getItemName() { return itemName; }
  public String getCategory() { return category; }
  public int getTotalQuantity() { return totalQuantity; }
  public int getRemainingQuantity() { return remainingQuantity; }
  public Instant getLastRestocked() { return lastRestocked; }
  public int getThresholdLimit() { return thresholdLimit; }
}
