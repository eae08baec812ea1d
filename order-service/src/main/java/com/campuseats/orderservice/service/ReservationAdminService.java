package com.campuseats.orderservice.service;

import com.campuseats.orderservice.dto.ReservationReleaseResponse;
import com.campuseats.orderservice.dto.SweepReport;
import com.campuseats.orderservice.job.ReconciliationSweeper;
import com.campuseats.orderservice.reservation.ReservationKey;
import com.campuseats.orderservice.reservation.ReservationLedger;
import com.campuseats.orderservice.reservation.ReservationStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Operator actions on the reservation ledger, for incident response.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReservationAdminService {

    private final ReservationLedger reservationLedger;
    private final ReconciliationSweeper reconciliationSweeper;

    public ReservationReleaseResponse forceReleaseOrderLocks(UUID orderId) {
        List<ReservationKey> released = reservationLedger.releaseAllHeldBy(OrderReservations.holderOf(orderId));
        log.warn("Operator force-released reservations: orderId={}, released={}", orderId, released.size());
        return ReservationReleaseResponse.builder()
                .orderId(orderId)
                .released(released.size())
                .keys(released.stream().map(ReservationKey::toString).collect(Collectors.toList()))
                .build();
    }

    public ReservationStats lockStatistics() {
        return reservationLedger.stats();
    }

    public int clearAllLocks() {
        log.warn("Operator cleared the reservation ledger");
        return reservationLedger.clearAll();
    }

    public SweepReport sweepNow() {
        return reconciliationSweeper.sweep();
    }
}
