package com.campuseats.common.exception;

/**
 * Exception thrown when an order, user, vendor or menu item does not exist
 * HTTP Status: 404 Not Found
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
