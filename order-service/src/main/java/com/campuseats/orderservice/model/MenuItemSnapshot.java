package com.campuseats.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Local read-only copy of a catalog entry. Prices and packability at checkout
 * are taken from here, never from the client.
 */
@Entity
@Table(name = "menu_item_snapshots")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class MenuItemSnapshot {

    @Id
    @ToString.Include
    private UUID itemId;

    @Column(nullable = false)
    private UUID vendorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ItemKind kind;

    @ToString.Include
    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private BigDecimal price;

    // packed items pick up the packaging charge on takeaway and delivery orders
    @Column(nullable = false)
    private boolean packable;
}
