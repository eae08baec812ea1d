package com.campuseats.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * The ordering side of a user: cart plus back-references to their orders.
 * Profile data lives with the identity provider.
 */
@Entity
@Table(name = "user_accounts")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class UserAccount {

    @Id
    @ToString.Include
    private UUID id;

    private String fullName;

    // A cart holds items of a single vendor, null while the cart is empty
    @Column(name = "cart_vendor_id")
    private UUID cartVendorId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_cart_items", joinColumns = @JoinColumn(name = "user_id"))
    private List<CartItem> cart = new ArrayList<>();

    // Maintained with native statements in UserAccountRepository
    @ElementCollection
    @CollectionTable(name = "user_active_orders", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "order_id")
    private Set<UUID> activeOrderIds = new LinkedHashSet<>();

    @ElementCollection
    @CollectionTable(name = "user_past_orders", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "order_id")
    private Set<UUID> pastOrderIds = new LinkedHashSet<>();
}
