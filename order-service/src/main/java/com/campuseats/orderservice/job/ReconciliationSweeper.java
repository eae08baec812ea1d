package com.campuseats.orderservice.job;

import com.campuseats.orderservice.dto.SweepReport;
import com.campuseats.orderservice.model.Order;
import com.campuseats.orderservice.model.OrderStatus;
import com.campuseats.orderservice.repository.OrderRepository;
import com.campuseats.orderservice.repository.UserAccountRepository;
import com.campuseats.orderservice.repository.VendorRepository;
import com.campuseats.orderservice.reservation.ReservationLedger;
import com.campuseats.orderservice.service.OrderReservations;
import com.campuseats.orderservice.service.OrderStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Periodic clean-up that bounds how long stock can be wrongly held.
 *
 * <ol>
 *   <li>Pending orders past their reservation window are moved to EXPIRED (only if still
 *       pending, so a commit that just won is left alone), their claims released and the
 *       order deleted together with its back-references.</li>
 *   <li>Expired ledger claims are evicted, including those of checkouts that never got as
 *       far as saving an order.</li>
 *   <li>Expired orders left behind by an earlier sweep are removed and user and vendor
 *       order lists are repaired against the orders table.</li>
 * </ol>
 * Every step is independent; a failure is logged and the rest of the sweep still runs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReconciliationSweeper {

    private static final List<String> ACTIVE_STATUS_NAMES = OrderStatus.ACTIVE.stream()
            .map(Enum::name)
            .collect(Collectors.toList());

    private final OrderRepository orderRepository;
    private final UserAccountRepository userAccountRepository;
    private final VendorRepository vendorRepository;
    private final OrderStore orderStore;
    private final OrderReservations orderReservations;
    private final ReservationLedger reservationLedger;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${campuseats.sweeper.interval:600000}",
            initialDelayString = "${campuseats.sweeper.initial-delay:60000}")
    public SweepReport sweep() {
        log.info("Reconciliation sweep started");
        int failures = 0;

        int expired = 0;
        List<Order> overdue;
        do {
            overdue = orderRepository.findTop200ByStatusInAndReservationExpiresAtBeforeOrderByReservationExpiresAtAsc(
                    OrderStatus.PENDING, clock.instant());
            int expiredInBatch = 0;
            for (Order order : overdue) {
                try {
                    if (expire(order)) {
                        expired++;
                        expiredInBatch++;
                    }
                } catch (RuntimeException e) {
                    failures++;
                    log.error("Failed to expire order: orderId={}", order.getId(), e);
                }
            }
            // a batch in which nothing could be expired would come back unchanged
            if (expiredInBatch == 0) {
                break;
            }
        } while (overdue.size() == 200);

        int evicted = 0;
        try {
            evicted = reservationLedger.evictExpired();
        } catch (RuntimeException e) {
            failures++;
            log.error("Failed to evict expired reservations", e);
        }

        int repaired = 0;
        for (Order leftover : orderRepository.findTop200ByStatus(OrderStatus.EXPIRED)) {
            // expired on an earlier sweep but not removed
            if (orderStore.unlinkAndDelete(leftover)) {
                repaired++;
            } else {
                failures++;
            }
        }
        try {
            repaired += userAccountRepository.copyDeliveredToPast();
            repaired += userAccountRepository.removeStaleActiveOrders(ACTIVE_STATUS_NAMES);
            repaired += vendorRepository.removeStaleActiveOrders(ACTIVE_STATUS_NAMES);
        } catch (RuntimeException e) {
            failures++;
            log.error("Back-reference repair failed", e);
        }

        SweepReport report = SweepReport.builder()
                .expiredOrders(expired)
                .evictedReservations(evicted)
                .repairedBackReferences(repaired)
                .failures(failures)
                .build();
        log.info("Reconciliation sweep finished: expiredOrders={}, evictedReservations={}, repaired={}, failures={}",
                expired, evicted, repaired, failures);
        return report;
    }

    private boolean expire(Order order) {
        Optional<Order> expired = orderStore.transition(order.getId(), OrderStatus.PENDING, OrderStatus.EXPIRED,
                "Reservation expired");
        if (expired.isEmpty()) {
            // committed or cancelled since it was read
            return false;
        }
        orderReservations.release(expired.get());
        if (!orderStore.unlinkAndDelete(expired.get())) {
            log.warn("Expired order only partially removed, next sweep will repair: orderId={}", order.getId());
        }
        log.info("Order expired: orderId={}, orderNumber={}", order.getId(), order.getOrderNumber());
        return true;
    }
}
