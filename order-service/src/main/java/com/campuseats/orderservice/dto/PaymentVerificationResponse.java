package com.campuseats.orderservice.dto;

import com.campuseats.orderservice.model.OrderStatus;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Data
@Builder
public class PaymentVerificationResponse {
    private boolean verified;
    private UUID orderId;
    private String orderNumber;
    private OrderStatus status;
    private String message;
}
