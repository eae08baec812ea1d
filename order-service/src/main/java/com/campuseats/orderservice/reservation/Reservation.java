package com.campuseats.orderservice.reservation;

import lombok.Value;

import java.time.Instant;

/**
 * A live claim of one holder on one key.
 */
@Value
public class Reservation {
    ReservationKey key;
    String holder;
    int quantity;
    boolean exclusive;
    Instant acquiredAt;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
