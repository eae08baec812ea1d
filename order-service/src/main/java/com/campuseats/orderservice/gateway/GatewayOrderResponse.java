package com.campuseats.orderservice.gateway;

import lombok.Data;

@Data
public class GatewayOrderResponse {
    private String id;
    private long amount;
    private String currency;
    private String receipt;
    private String status;
}
