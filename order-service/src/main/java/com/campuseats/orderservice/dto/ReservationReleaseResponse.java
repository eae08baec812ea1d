package com.campuseats.orderservice.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
@Builder
public class ReservationReleaseResponse {
    private UUID orderId;
    private int released;
    private List<String> keys;
}
