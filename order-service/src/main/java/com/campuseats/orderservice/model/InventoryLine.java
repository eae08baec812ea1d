package com.campuseats.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Durable stock of one item at one vendor.
 * Only the column matching {@link #kind} is meaningful.
 */
@Entity
@Table(name = "inventory_lines", uniqueConstraints = @UniqueConstraint(
        name = "uk_inventory_vendor_item", columnNames = {"vendor_id", "item_id"}))
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class InventoryLine {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ToString.Include
    @Column(name = "vendor_id", nullable = false)
    private UUID vendorId;

    @ToString.Include
    @Column(name = "item_id", nullable = false)
    private UUID itemId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ItemKind kind;

    // RETAIL
    @ToString.Include
    @Column(nullable = false)
    private int quantity;

    // PRODUCE
    @Column(nullable = false)
    private boolean available;

    // RAW_MATERIAL
    private BigDecimal openingAmount;

    private BigDecimal closingAmount;

    private Instant lastSoldAt;
}
