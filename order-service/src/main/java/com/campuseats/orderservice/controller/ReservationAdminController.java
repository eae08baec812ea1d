package com.campuseats.orderservice.controller;

import com.campuseats.orderservice.dto.ReservationReleaseResponse;
import com.campuseats.orderservice.dto.SweepReport;
import com.campuseats.orderservice.reservation.ReservationStats;
import com.campuseats.orderservice.service.ReservationAdminService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

// Operator endpoints; the gateway only routes these for admin callers
@RestController
@RequestMapping("/api/v1/admin/reservations")
@RequiredArgsConstructor
public class ReservationAdminController {

    private final ReservationAdminService reservationAdminService;

    @GetMapping("/stats")
    public ResponseEntity<ReservationStats> stats() {
        return ResponseEntity.ok(reservationAdminService.lockStatistics());
    }

    @PostMapping("/orders/{orderId}/release")
    public ResponseEntity<ReservationReleaseResponse> forceRelease(@PathVariable UUID orderId) {
        return ResponseEntity.ok(reservationAdminService.forceReleaseOrderLocks(orderId));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Integer>> clearAll() {
        return ResponseEntity.ok(Map.of("cleared", reservationAdminService.clearAllLocks()));
    }

    @PostMapping("/sweep")
    public ResponseEntity<SweepReport> sweep() {
        return ResponseEntity.ok(reservationAdminService.sweepNow());
    }
}
