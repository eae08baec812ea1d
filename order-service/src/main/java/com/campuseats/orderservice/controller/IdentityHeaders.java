package com.campuseats.orderservice.controller;

/**
 * Identity headers set by the API gateway after authenticating the caller.
 */
public final class IdentityHeaders {

    public static final String USER_ID = "X-User-Id";
    public static final String VENDOR_ID = "X-Vendor-Id";

    private IdentityHeaders() {
    }
}
