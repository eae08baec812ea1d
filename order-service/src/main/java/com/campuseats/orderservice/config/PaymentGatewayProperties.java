package com.campuseats.orderservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "campuseats.payment-gateway")
public class PaymentGatewayProperties {

    private String baseUrl = "https://api.razorpay.com";

    private String keyId;

    // also the HMAC secret for payment signatures
    private String keySecret;

    private Duration timeout = Duration.ofSeconds(10);
}
