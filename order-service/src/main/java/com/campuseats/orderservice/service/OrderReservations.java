package com.campuseats.orderservice.service;

import com.campuseats.orderservice.model.Order;
import com.campuseats.orderservice.model.OrderItem;
import com.campuseats.orderservice.reservation.ReleaseResult;
import com.campuseats.orderservice.reservation.ReservationKey;
import com.campuseats.orderservice.reservation.ReservationLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Ties ledger claims to orders. A checkout claims its keys under the order id, so an
 * order's claims can always be found again from the order alone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderReservations {

    private final ReservationLedger ledger;

    public static String holderOf(UUID orderId) {
        return orderId.toString();
    }

    public static List<ReservationKey> keysOf(Order order) {
        return order.getItems().stream()
                .map(item -> keyOf(order.getVendorId(), item))
                .distinct()
                .collect(Collectors.toList());
    }

    public static ReservationKey keyOf(UUID vendorId, OrderItem item) {
        return new ReservationKey(vendorId, item.getKind(), item.getItemId());
    }

    public ReleaseResult release(Order order) {
        ReleaseResult result = ledger.release(keysOf(order), holderOf(order.getId()));
        if (!result.getNotFound().isEmpty()) {
            // expired or already released, nothing left to do
            log.debug("Reservations already gone: orderId={}, keys={}", order.getId(), result.getNotFound());
        }
        log.info("Reservations released: orderId={}, released={}", order.getId(), result.getReleased().size());
        return result;
    }

    public ReleaseResult release(UUID orderId, List<ReservationKey> keys) {
        return ledger.release(keys, holderOf(orderId));
    }
}
