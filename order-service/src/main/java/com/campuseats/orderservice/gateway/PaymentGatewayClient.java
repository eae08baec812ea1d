package com.campuseats.orderservice.gateway;

import com.campuseats.orderservice.config.PaymentGatewayProperties;
import com.campuseats.orderservice.exception.ExternalServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Creates gateway-side orders that the client then pays against.
 */
@Component
@Slf4j
public class PaymentGatewayClient {

    private final WebClient webClient;
    private final PaymentGatewayProperties properties;

    public PaymentGatewayClient(@Qualifier("paymentGatewayWebClient") WebClient webClient,
            PaymentGatewayProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    public GatewayOrderResponse createOrder(long amountInMinorUnits, String currency, String receipt) {
        GatewayOrderRequest request = new GatewayOrderRequest(amountInMinorUnits, currency, receipt);
        try {
            GatewayOrderResponse response = webClient.post()
                    .uri("/v1/orders")
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(GatewayOrderResponse.class)
                    .block(properties.getTimeout());

            if (response == null || response.getId() == null) {
                throw new ExternalServiceException("Payment gateway returned no order for receipt " + receipt);
            }
            log.info("Gateway order created: receipt={}, gatewayOrderId={}", receipt, response.getId());
            return response;

        } catch (WebClientResponseException e) {
            log.error("Payment gateway rejected order: receipt={}, status={}, body={}",
                    receipt, e.getStatusCode(), e.getResponseBodyAsString());
            throw new ExternalServiceException("Payment gateway rejected the order: " + e.getStatusCode(), e);
        } catch (ExternalServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            // connection errors and the block() timeout end up here
            log.error("Payment gateway unreachable: receipt={}, error={}", receipt, e.getMessage());
            throw new ExternalServiceException("Payment gateway is unavailable", e);
        }
    }

    public String getKeyId() {
        return properties.getKeyId();
    }
}
