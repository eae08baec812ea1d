package com.campuseats.orderservice.service;

import com.campuseats.orderservice.dto.CheckoutRequest;
import com.campuseats.orderservice.dto.CheckoutResponse;

import java.util.UUID;

public interface CheckoutService {

    /**
     * Turns the user's cart into a pending order holding reservations on every line.
     */
    CheckoutResponse checkout(UUID userId, CheckoutRequest request);
}
