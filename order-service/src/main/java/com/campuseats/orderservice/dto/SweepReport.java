package com.campuseats.orderservice.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SweepReport {
    private int expiredOrders;
    private int evictedReservations;
    private int repairedBackReferences;
    private int failures;
}
