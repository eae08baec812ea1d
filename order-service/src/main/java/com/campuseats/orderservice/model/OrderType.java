package com.campuseats.orderservice.model;

public enum OrderType {
    DINE_IN,
    TAKEAWAY,
    DELIVERY
}
