package com.campuseats.orderservice.model;

public enum PaymentMethod {
    ONLINE,          // paid through the payment gateway, committed on signature verification
    CASH,            // paid at the counter, committed when the vendor confirms
    VENDOR_APPROVAL  // no payment up front, committed when the vendor accepts
}
