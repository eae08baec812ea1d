package com.campuseats.orderservice.exception;

/**
 * Exception thrown when the payment gateway can't be reached or rejects a call
 * HTTP Status: 502 Bad Gateway
 */
public class ExternalServiceException extends RuntimeException {

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
