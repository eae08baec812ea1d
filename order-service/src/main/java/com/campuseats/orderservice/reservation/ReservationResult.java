package com.campuseats.orderservice.reservation;

import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class ReservationResult {
    boolean granted;
    // keys that could not be claimed, empty when granted
    List<ReservationKey> conflicts;
    Instant expiresAt;

    static ReservationResult granted(Instant expiresAt) {
        return new ReservationResult(true, List.of(), expiresAt);
    }

    static ReservationResult conflict(List<ReservationKey> keys) {
        return new ReservationResult(false, List.copyOf(keys), null);
    }
}
