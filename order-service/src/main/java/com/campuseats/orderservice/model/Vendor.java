package com.campuseats.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "vendors")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Vendor {

    @Id
    @ToString.Include
    private UUID id;

    @Column(nullable = false)
    private String name;

    // false while the outlet is closed for the day
    @Column(nullable = false)
    private boolean open = true;

    @Column(nullable = false)
    private boolean offersDelivery;

    @ElementCollection
    @CollectionTable(name = "vendor_active_orders", joinColumns = @JoinColumn(name = "vendor_id"))
    @Column(name = "order_id")
    private Set<UUID> activeOrderIds = new LinkedHashSet<>();
}
