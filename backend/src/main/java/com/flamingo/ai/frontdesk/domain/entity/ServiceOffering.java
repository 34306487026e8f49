package com.flamingo.ai.frontdesk.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A structured offering of a business: the source of truth for price and duration. */
@Entity
@Table(name = "services")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ServiceOffering {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "business_id", nullable = false)
  private UUID businessId;

  @Column(nullable = false, length = 200)
  private String name;

  @Column(columnDefinition = "TEXT")
  private String description;

  @Column(precision = 10, scale = 2)
  private BigDecimal price;

  /** Free-form price label such as "Free" or "Starting at $50". Wins over {@link #price}. */
  @Column(length = 50)
  private String priceDisplay;

  /** Duration in minutes. */
  private Integer duration;

  @Column(name = "is_active", nullable = false)
  @Builder.Default
  private boolean active = true;

  @Builder.Default private int displayOrder = 0;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /** Human-readable price, e.g. {@code $30} or {@code $42.50}. */
  public String formattedPrice() {
    if (priceDisplay != null && !priceDisplay.isBlank()) {
      return priceDisplay;
    }
    if (price == null) {
      return "Contact for pricing";
    }
    BigDecimal scaled = price.setScale(2, RoundingMode.HALF_UP);
    if (scaled.stripTrailingZeros().scale() <= 0) {
      return "$" + scaled.setScale(0, RoundingMode.UNNECESSARY).toPlainString();
    }
    return "$" + scaled.toPlainString();
  }

  /** Human-readable duration, e.g. {@code 30m} or {@code 1h 30m}. */
  public String formattedDuration() {
    if (duration == null || duration <= 0) {
      return "Duration varies";
    }
    int hours = duration / 60;
    int minutes = duration % 60;
    if (hours > 0 && minutes > 0) {
      return hours + "h " + minutes + "m";
    }
    if (hours > 0) {
      return hours + "h";
    }
    return minutes + "m";
  }

  /** True when the service has a price or a price label. */
  public boolean hasPrice() {
    return price != null || (priceDisplay != null && !priceDisplay.isBlank());
  }
}
