package com.campuseats.orderservice.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
@Builder
public class CartResponse {
    private UUID userId;
    private UUID vendorId;
    private List<CartItemResponse> items;
}
