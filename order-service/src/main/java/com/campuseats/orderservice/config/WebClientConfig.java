package com.campuseats.orderservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient paymentGatewayWebClient(WebClient.Builder builder, PaymentGatewayProperties properties) {
        return builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeaders(headers -> {
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    if (StringUtils.hasText(properties.getKeyId()) && StringUtils.hasText(properties.getKeySecret())) {
                        headers.setBasicAuth(properties.getKeyId(), properties.getKeySecret());
                    }
                })
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
