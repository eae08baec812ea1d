package com.campuseats.orderservice.exception;

/**
 * Exception thrown when no order number could be minted because the counter store failed
 * HTTP Status: 503 Service Unavailable
 */
public class OrderNumberUnavailableException extends RuntimeException {

    public OrderNumberUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
