package com.campuseats.orderservice.repository;

import com.campuseats.orderservice.model.Vendor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface VendorRepository extends JpaRepository<Vendor, UUID> {

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "INSERT INTO vendor_active_orders (vendor_id, order_id) SELECT :vendorId, :orderId " +
            "WHERE NOT EXISTS (SELECT 1 FROM vendor_active_orders WHERE vendor_id = :vendorId AND order_id = :orderId)",
            nativeQuery = true)
    int pushActiveOrder(@Param("vendorId") UUID vendorId, @Param("orderId") UUID orderId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "DELETE FROM vendor_active_orders WHERE vendor_id = :vendorId AND order_id = :orderId",
            nativeQuery = true)
    int pullActiveOrder(@Param("vendorId") UUID vendorId, @Param("orderId") UUID orderId);

    @Query(value = "SELECT order_id FROM vendor_active_orders WHERE vendor_id = :vendorId", nativeQuery = true)
    List<UUID> findActiveOrderIds(@Param("vendorId") UUID vendorId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "DELETE FROM vendor_active_orders v WHERE NOT EXISTS " +
            "(SELECT 1 FROM orders o WHERE o.id = v.order_id AND o.status IN (:activeStatuses))",
            nativeQuery = true)
    int removeStaleActiveOrders(@Param("activeStatuses") Collection<String> activeStatuses);
}
