package com.campuseats.orderservice.config;

import com.campuseats.orderservice.service.OrderNumberScope;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Checkout and pricing settings.
 *
 * <pre>
 * campuseats.orders.order-number-prefix=CE
 * campuseats.orders.reservation-ttl=PT30M
 * campuseats.orders.packaging-charge=5
 * </pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "campuseats.orders")
public class OrderProperties {

    private String orderNumberPrefix = "CE";

    private OrderNumberScope orderNumberScope = OrderNumberScope.DAY;

    /**
     * How long a pending order may hold its reservations before the sweeper expires it.
     */
    private Duration reservationTtl = Duration.ofMinutes(30);

    /**
     * Charged per packable unit on takeaway and delivery orders.
     */
    private BigDecimal packagingCharge = BigDecimal.valueOf(5);

    private BigDecimal deliveryCharge = BigDecimal.valueOf(50);

    private BigDecimal platformFee = BigDecimal.valueOf(2);

    private String currency = "INR";

    private int maxRetailQuantity = 15;

    private int maxProduceQuantity = 10;

    /**
     * Whether committing an order marks its produce items unavailable.
     */
    private boolean produceSoldOutOnCommit = true;

    private String defaultDenialReason = "Item not available";
}
