package com.campuseats.orderservice;

import com.campuseats.orderservice.dto.CheckoutRequest;
import com.campuseats.orderservice.dto.CheckoutResponse;
import com.campuseats.orderservice.dto.PaymentVerificationRequest;
import com.campuseats.orderservice.dto.PaymentVerificationResponse;
import com.campuseats.orderservice.exception.InvalidOrderStateException;
import com.campuseats.orderservice.gateway.GatewayOrderResponse;
import com.campuseats.orderservice.gateway.PaymentGatewayClient;
import com.campuseats.orderservice.model.MenuItemSnapshot;
import com.campuseats.orderservice.model.Order;
import com.campuseats.orderservice.model.OrderStatus;
import com.campuseats.orderservice.model.OrderType;
import com.campuseats.orderservice.model.OutboxEvent;
import com.campuseats.orderservice.model.PaymentMethod;
import com.campuseats.orderservice.model.UserAccount;
import com.campuseats.orderservice.model.Vendor;
import com.campuseats.orderservice.repository.OrderRepository;
import com.campuseats.orderservice.repository.OutboxRepository;
import com.campuseats.orderservice.reservation.ReservationLedger;
import com.campuseats.orderservice.service.CheckoutService;
import com.campuseats.orderservice.service.OrderCompletionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

public class PaymentVerificationIntegrationTest extends AbstractIntegrationTest {

    // matches campuseats.payment-gateway.key-secret in application-test.yml
    private static final String SECRET = "test-secret";

    @MockBean
    private PaymentGatewayClient paymentGatewayClient;

    @Autowired
    private CheckoutService checkoutService;

    @Autowired
    private OrderCompletionService orderCompletionService;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private OutboxRepository outboxRepository;

    @Autowired
    private ReservationLedger reservationLedger;

    private MenuItemSnapshot sandwich;
    private UserAccount user;
    private String gatewayOrderId;

    @BeforeEach
    void setUp() {
        reservationLedger.clearAll();
        Vendor vendor = createVendor(false);
        sandwich = createRetailItem(vendor, "Veg Sandwich", "45", 10);
        user = createUserWithCart(sandwich, 2);

        gatewayOrderId = "order_" + UUID.randomUUID().toString().substring(0, 8);
        GatewayOrderResponse gatewayOrder = new GatewayOrderResponse();
        gatewayOrder.setId(gatewayOrderId);
        gatewayOrder.setAmount(10200);
        gatewayOrder.setCurrency("INR");
        when(paymentGatewayClient.createOrder(anyLong(), anyString(), anyString())).thenReturn(gatewayOrder);
        when(paymentGatewayClient.getKeyId()).thenReturn("rzp_test_key");
    }

    private CheckoutResponse checkoutOnline() {
        CheckoutRequest request = new CheckoutRequest();
        request.setOrderType(OrderType.TAKEAWAY);
        request.setPaymentMethod(PaymentMethod.ONLINE);
        request.setCollectorName("Meera");
        request.setCollectorPhone("9123456780");
        return checkoutService.checkout(user.getId(), request);
    }

    private PaymentVerificationRequest verification(UUID orderId, String paymentId, String signature) {
        PaymentVerificationRequest request = new PaymentVerificationRequest();
        request.setOrderId(orderId);
        request.setGatewayOrderId(gatewayOrderId);
        request.setGatewayPaymentId(paymentId);
        request.setSignature(signature);
        return request;
    }

    private static String sign(String payload) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void should_commit_order_once_for_a_valid_payment() throws Exception {
        // Arrange
        CheckoutResponse checkout = checkoutOnline();
        UUID orderId = checkout.getOrder().getId();
        assertThat(checkout.getGatewayOrderId()).isEqualTo(gatewayOrderId);
        String signature = sign(gatewayOrderId + "|pay_001");

        // Act
        PaymentVerificationResponse first = orderCompletionService.verifyPayment(
                verification(orderId, "pay_001", signature), user.getId());
        PaymentVerificationResponse repeated = orderCompletionService.verifyPayment(
                verification(orderId, "pay_001", signature), user.getId());

        // Assert
        assertThat(first.isVerified()).isTrue();
        assertThat(first.getStatus()).isEqualTo(OrderStatus.IN_PROGRESS);
        assertThat(repeated.isVerified()).isTrue();

        Order order = orderRepository.findById(orderId).orElseThrow();
        assertThat(order.getPaymentReference()).isEqualTo("pay_001");
        assertThat(order.getGatewayOrderId()).isEqualTo(gatewayOrderId);
        // stock was decremented by the first verification only
        assertThat(inventoryLineRepository.findQuantity(sandwich.getVendorId(), sandwich.getItemId())).contains(8);
        assertThat(reservationLedger.listForItem(sandwich.getItemId())).isEmpty();

        assertThat(outboxRepository.findByAggregateIdOrderByCreatedAtAsc(orderId.toString()))
                .extracting(OutboxEvent::getType)
                .containsExactly("order.created", "order.in_progress");
    }

    @Test
    void should_fail_order_and_release_stock_for_a_tampered_signature() throws Exception {
        // Arrange
        UUID orderId = checkoutOnline().getOrder().getId();
        String signatureForOtherPayment = sign(gatewayOrderId + "|pay_other");

        // Act
        PaymentVerificationResponse response = orderCompletionService.verifyPayment(
                verification(orderId, "pay_001", signatureForOtherPayment), user.getId());

        // Assert
        assertThat(response.isVerified()).isFalse();
        assertThat(response.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(inventoryLineRepository.findQuantity(sandwich.getVendorId(), sandwich.getItemId())).contains(10);
        assertThat(reservationLedger.listForItem(sandwich.getItemId())).isEmpty();

        // a correct signature can't revive a failed order
        String valid = sign(gatewayOrderId + "|pay_001");
        assertThatThrownBy(() -> orderCompletionService.verifyPayment(
                verification(orderId, "pay_001", valid), user.getId()))
                .isInstanceOf(InvalidOrderStateException.class);
    }
}
