package com.campuseats.orderservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

/**
 * Result of a checkout. The gateway fields are only set for ONLINE orders and are what
 * the client needs to open the gateway's payment page.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CheckoutResponse {
    private OrderResponse order;
    private String gatewayOrderId;
    private Long amountInMinorUnits;
    private String currency;
    private String gatewayKeyId;
}
