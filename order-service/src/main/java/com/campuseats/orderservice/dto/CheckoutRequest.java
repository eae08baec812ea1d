package com.campuseats.orderservice.dto;

import com.campuseats.orderservice.model.OrderType;
import com.campuseats.orderservice.model.PaymentMethod;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CheckoutRequest {

    @NotNull(message = "Order type cannot be null")
    private OrderType orderType;

    @NotNull(message = "Payment method cannot be null")
    private PaymentMethod paymentMethod;

    @NotBlank(message = "Collector name is required")
    @Size(max = 100, message = "Collector name is too long")
    private String collectorName;

    @NotBlank(message = "Collector phone is required")
    @Pattern(regexp = "^[0-9+ -]{7,20}$", message = "Collector phone is not a valid phone number")
    private String collectorPhone;

    // Required for DELIVERY orders, checked in the service
    @Size(max = 500, message = "Address is too long")
    private String address;
}
