package com.campuseats.orderservice.repository;

import com.campuseats.orderservice.model.InventoryLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InventoryLineRepository extends JpaRepository<InventoryLine, UUID> {

    List<InventoryLine> findByVendorIdAndItemIdIn(UUID vendorId, Collection<UUID> itemIds);

    Optional<InventoryLine> findByVendorIdAndItemId(UUID vendorId, UUID itemId);

    // Atomic guarded decrement: returns 0 instead of going negative
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE InventoryLine l SET l.quantity = l.quantity - :quantity, l.lastSoldAt = :now " +
            "WHERE l.vendorId = :vendorId AND l.itemId = :itemId " +
            "AND l.kind = com.campuseats.orderservice.model.ItemKind.RETAIL AND l.quantity >= :quantity")
    int decreaseRetailQuantity(@Param("vendorId") UUID vendorId,
            @Param("itemId") UUID itemId,
            @Param("quantity") int quantity,
            @Param("now") Instant now);

    // Returns 0 if the item was no longer available
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE InventoryLine l SET l.available = :stillAvailable, l.lastSoldAt = :now " +
            "WHERE l.vendorId = :vendorId AND l.itemId = :itemId " +
            "AND l.kind = com.campuseats.orderservice.model.ItemKind.PRODUCE AND l.available = true")
    int sellProduce(@Param("vendorId") UUID vendorId,
            @Param("itemId") UUID itemId,
            @Param("stillAvailable") boolean stillAvailable,
            @Param("now") Instant now);

    @Query("SELECT l.quantity FROM InventoryLine l WHERE l.vendorId = :vendorId AND l.itemId = :itemId")
    Optional<Integer> findQuantity(@Param("vendorId") UUID vendorId, @Param("itemId") UUID itemId);
}
