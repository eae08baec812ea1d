package com.campuseats.orderservice.dto;

import com.campuseats.orderservice.model.OrderStatus;
import com.campuseats.orderservice.model.OrderType;
import com.campuseats.orderservice.model.PaymentMethod;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class OrderResponse {
    private UUID id;
    private String orderNumber;
    private UUID userId;
    private UUID vendorId;
    private List<OrderItemResponse> items;
    private BigDecimal itemsTotal;
    private BigDecimal packagingCharge;
    private BigDecimal deliveryCharge;
    private BigDecimal platformFee;
    private BigDecimal total;
    private OrderType orderType;
    private PaymentMethod paymentMethod;
    private String collectorName;
    private String collectorPhone;
    private String address;
    private OrderStatus status;
    private String denialReason;
    private Instant reservationExpiresAt;
    private Instant createdAt;
}
