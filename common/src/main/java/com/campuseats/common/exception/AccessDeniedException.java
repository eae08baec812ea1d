package com.campuseats.common.exception;

/**
 * Exception thrown when a user or vendor acts on an order they don't own
 * HTTP Status: 403 Forbidden (set in GlobalExceptionHandler)
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
