package com.campuseats.orderservice.exception;

/**
 * Exception thrown when an order is not in a status the requested action accepts,
 * e.g. accepting an order that is already in progress
 * HTTP Status: 422 Unprocessable Entity
 */
public class InvalidOrderStateException extends RuntimeException {

    public InvalidOrderStateException(String message) {
        super(message);
    }
}
