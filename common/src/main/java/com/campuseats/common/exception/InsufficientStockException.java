package com.campuseats.common.exception;

/**
 * Exception thrown when committed inventory can no longer cover an order line
 * HTTP Status: 422 Unprocessable Entity
 */
public class InsufficientStockException extends RuntimeException {

    public InsufficientStockException(String message) {
        super(message);
    }

    public InsufficientStockException(String message, Throwable cause) {
        super(message, cause);
    }
}
