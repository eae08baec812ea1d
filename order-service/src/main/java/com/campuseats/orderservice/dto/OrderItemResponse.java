package com.campuseats.orderservice.dto;

import com.campuseats.orderservice.model.ItemKind;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
public class OrderItemResponse {
    private UUID itemId;
    private ItemKind kind;
    private String name;
    private BigDecimal unitPrice;
    private Integer quantity;
    private boolean packable;
}
