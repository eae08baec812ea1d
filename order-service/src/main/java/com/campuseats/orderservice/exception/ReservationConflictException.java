package com.campuseats.orderservice.exception;

import java.util.List;

/**
 * Exception thrown when checkout can't reserve every cart line.
 * Carries the names of the unavailable items, never who holds them.
 * HTTP Status: 409 Conflict
 */
public class ReservationConflictException extends RuntimeException {

    private final List<String> unavailableItems;

    public ReservationConflictException(List<String> unavailableItems) {
        super("Some items are currently unavailable: " + String.join(", ", unavailableItems));
        this.unavailableItems = List.copyOf(unavailableItems);
    }

    public List<String> getUnavailableItems() {
        return unavailableItems;
    }
}
