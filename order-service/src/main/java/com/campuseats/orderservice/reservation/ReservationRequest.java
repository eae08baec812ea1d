package com.campuseats.orderservice.reservation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One key of an acquire call.
 * Exclusive requests allow a single holder per key. Counted requests may share a key
 * as long as the live claims of all holders fit into {@code onHand}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReservationRequest {
    ReservationKey key;
    boolean exclusive;
    int quantity;
    int onHand;

    public static ReservationRequest exclusive(ReservationKey key) {
        return new ReservationRequest(key, true, 1, 1);
    }

    public static ReservationRequest counted(ReservationKey key, int quantity, int onHand) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Reserved quantity must be positive: " + quantity);
        }
        return new ReservationRequest(key, false, quantity, onHand);
    }

    ReservationRequest plus(ReservationRequest other) {
        if (exclusive || other.exclusive) {
            return this;
        }
        return new ReservationRequest(key, false, quantity + other.quantity, Math.min(onHand, other.onHand));
    }
}
