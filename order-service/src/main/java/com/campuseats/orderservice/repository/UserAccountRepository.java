package com.campuseats.orderservice.repository;

import com.campuseats.orderservice.model.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Back-reference lists are kept with idempotent native statements so concurrent
 * pushes and pulls never overwrite each other the way a load-modify-save would.
 */
@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "INSERT INTO user_active_orders (user_id, order_id) SELECT :userId, :orderId " +
            "WHERE NOT EXISTS (SELECT 1 FROM user_active_orders WHERE user_id = :userId AND order_id = :orderId)",
            nativeQuery = true)
    int pushActiveOrder(@Param("userId") UUID userId, @Param("orderId") UUID orderId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "DELETE FROM user_active_orders WHERE user_id = :userId AND order_id = :orderId",
            nativeQuery = true)
    int pullActiveOrder(@Param("userId") UUID userId, @Param("orderId") UUID orderId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "INSERT INTO user_past_orders (user_id, order_id) SELECT :userId, :orderId " +
            "WHERE NOT EXISTS (SELECT 1 FROM user_past_orders WHERE user_id = :userId AND order_id = :orderId)",
            nativeQuery = true)
    int pushPastOrder(@Param("userId") UUID userId, @Param("orderId") UUID orderId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "DELETE FROM user_past_orders WHERE user_id = :userId AND order_id = :orderId",
            nativeQuery = true)
    int pullPastOrder(@Param("userId") UUID userId, @Param("orderId") UUID orderId);

    @Query(value = "SELECT order_id FROM user_active_orders WHERE user_id = :userId", nativeQuery = true)
    List<UUID> findActiveOrderIds(@Param("userId") UUID userId);

    @Query(value = "SELECT order_id FROM user_past_orders WHERE user_id = :userId", nativeQuery = true)
    List<UUID> findPastOrderIds(@Param("userId") UUID userId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "DELETE FROM user_cart_items WHERE user_id = :userId", nativeQuery = true)
    int deleteCartItems(@Param("userId") UUID userId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "UPDATE user_accounts SET cart_vendor_id = NULL WHERE id = :userId", nativeQuery = true)
    int clearCartVendor(@Param("userId") UUID userId);

    // Repair: delivered orders still listed as active get copied to the past list
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "INSERT INTO user_past_orders (user_id, order_id) " +
            "SELECT a.user_id, a.order_id FROM user_active_orders a JOIN orders o ON o.id = a.order_id " +
            "WHERE o.status = 'DELIVERED' AND NOT EXISTS " +
            "(SELECT 1 FROM user_past_orders p WHERE p.user_id = a.user_id AND p.order_id = a.order_id)",
            nativeQuery = true)
    int copyDeliveredToPast();

    // Repair: active entries pointing at missing orders or orders that are no longer active
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "DELETE FROM user_active_orders a WHERE NOT EXISTS " +
            "(SELECT 1 FROM orders o WHERE o.id = a.order_id AND o.status IN (:activeStatuses))",
            nativeQuery = true)
    int removeStaleActiveOrders(@Param("activeStatuses") Collection<String> activeStatuses);
}
