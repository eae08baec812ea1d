package com.campuseats.orderservice.dto;

import com.campuseats.orderservice.model.ItemKind;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Data
@Builder
public class CartItemResponse {
    private UUID itemId;
    private ItemKind kind;
    private Integer quantity;
}
