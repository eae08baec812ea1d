package com.campuseats.orderservice.repository;

import com.campuseats.orderservice.model.Order;
import com.campuseats.orderservice.model.OrderStatus;
import com.campuseats.orderservice.model.PaymentMethod;
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
public interface OrderRepository extends JpaRepository<Order, UUID> {

    Optional<Order> findByIdAndDeletedFalse(UUID id);

    List<Order> findByUserIdAndDeletedFalseOrderByCreatedAtDesc(UUID userId);

    List<Order> findByUserIdAndStatusAndDeletedFalse(UUID userId, OrderStatus status);

    List<Order> findByVendorIdAndStatusInAndDeletedFalseOrderByCreatedAtAsc(UUID vendorId,
            Collection<OrderStatus> statuses);

    List<Order> findByVendorIdAndStatusInAndDeletedFalseOrderByCreatedAtDesc(UUID vendorId,
            Collection<OrderStatus> statuses);

    // cash orders still waiting at the counter
    List<Order> findByVendorIdAndStatusAndPaymentMethodAndReservationExpiresAtAfterAndDeletedFalseOrderByCreatedAtAsc(
            UUID vendorId, OrderStatus status, PaymentMethod paymentMethod, Instant now);

    boolean existsByUserIdAndStatusAndReservationExpiresAtAfter(UUID userId, OrderStatus status, Instant now);

    // pending orders whose reservation window has closed, oldest first
    List<Order> findTop200ByStatusInAndReservationExpiresAtBeforeOrderByReservationExpiresAtAsc(
            Collection<OrderStatus> statuses, Instant cutoff);

    List<Order> findTop200ByStatus(OrderStatus status);

    /**
     * Moves an order to {@code next} only while it is still in one of {@code expected}.
     * Exactly one of several racing callers gets 1 back, the rest get 0.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.status = :next, o.updatedAt = :now, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.status IN :expected")
    int transition(@Param("id") UUID id,
            @Param("expected") Collection<OrderStatus> expected,
            @Param("next") OrderStatus next,
            @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.status = :next, o.denialReason = :reason, o.updatedAt = :now, " +
            "o.version = o.version + 1 WHERE o.id = :id AND o.status IN :expected")
    int transitionWithReason(@Param("id") UUID id,
            @Param("expected") Collection<OrderStatus> expected,
            @Param("next") OrderStatus next,
            @Param("reason") String reason,
            @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.status = :next, o.paymentReference = :paymentReference, o.updatedAt = :now, " +
            "o.version = o.version + 1 WHERE o.id = :id AND o.status IN :expected")
    int transitionWithPayment(@Param("id") UUID id,
            @Param("expected") Collection<OrderStatus> expected,
            @Param("next") OrderStatus next,
            @Param("paymentReference") String paymentReference,
            @Param("now") Instant now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.gatewayOrderId = :gatewayOrderId WHERE o.id = :id AND o.gatewayOrderId IS NULL")
    int attachGatewayOrder(@Param("id") UUID id, @Param("gatewayOrderId") String gatewayOrderId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.deleted = true, o.updatedAt = :now " +
            "WHERE o.id = :id AND o.vendorId = :vendorId AND o.status IN :statuses AND o.deleted = false")
    int softDelete(@Param("id") UUID id,
            @Param("vendorId") UUID vendorId,
            @Param("statuses") Collection<OrderStatus> statuses,
            @Param("now") Instant now);
}
