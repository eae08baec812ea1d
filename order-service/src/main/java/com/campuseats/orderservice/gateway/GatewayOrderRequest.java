package com.campuseats.orderservice.gateway;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GatewayOrderRequest {
    // in minor units (paise for INR)
    private long amount;
    private String currency;
    // idempotency key on the gateway side
    private String receipt;
}
