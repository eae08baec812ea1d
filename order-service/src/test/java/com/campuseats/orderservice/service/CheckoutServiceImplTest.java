package com.campuseats.orderservice.service;

import com.campuseats.orderservice.config.OrderProperties;
import com.campuseats.orderservice.dto.CheckoutRequest;
import com.campuseats.orderservice.dto.CheckoutResponse;
import com.campuseats.orderservice.dto.OrderResponse;
import com.campuseats.orderservice.exception.ExternalServiceException;
import com.campuseats.orderservice.exception.InvalidOrderStateException;
import com.campuseats.orderservice.exception.OrderNumberUnavailableException;
import com.campuseats.orderservice.exception.ReservationConflictException;
import com.campuseats.orderservice.gateway.GatewayOrderResponse;
import com.campuseats.orderservice.gateway.PaymentGatewayClient;
import com.campuseats.orderservice.mapper.OrderMapper;
import com.campuseats.orderservice.model.CartItem;
import com.campuseats.orderservice.model.InventoryLine;
import com.campuseats.orderservice.model.ItemKind;
import com.campuseats.orderservice.model.MenuItemSnapshot;
import com.campuseats.orderservice.model.Order;
import com.campuseats.orderservice.model.OrderStatus;
import com.campuseats.orderservice.model.OrderType;
import com.campuseats.orderservice.model.PaymentMethod;
import com.campuseats.orderservice.model.UserAccount;
import com.campuseats.orderservice.model.Vendor;
import com.campuseats.orderservice.repository.InventoryLineRepository;
import com.campuseats.orderservice.repository.MenuItemSnapshotRepository;
import com.campuseats.orderservice.repository.OrderRepository;
import com.campuseats.orderservice.repository.UserAccountRepository;
import com.campuseats.orderservice.repository.VendorRepository;
import com.campuseats.orderservice.reservation.ReservationKey;
import com.campuseats.orderservice.reservation.ReservationLedger;
import com.campuseats.orderservice.reservation.ReservationRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.QueryTimeoutException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("CheckoutServiceImpl Unit Tests")
class CheckoutServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-10-19T09:30:00Z");

    @Mock
    private UserAccountRepository userAccountRepository;
    @Mock
    private VendorRepository vendorRepository;
    @Mock
    private MenuItemSnapshotRepository menuItemSnapshotRepository;
    @Mock
    private InventoryLineRepository inventoryLineRepository;
    @Mock
    private OrderRepository orderRepository;
    @Mock
    private OrderNumberGenerator orderNumberGenerator;
    @Mock
    private OrderStore orderStore;
    @Mock
    private OrderCompletionService orderCompletionService;
    @Mock
    private PaymentGatewayClient paymentGatewayClient;
    @Mock
    private OrderMapper orderMapper;

    private ReservationLedger ledger;
    private OrderProperties orderProperties;
    private CheckoutServiceImpl checkoutService;

    private UUID userId;
    private Vendor vendor;
    private UserAccount user;
    private MenuItemSnapshot water;
    private MenuItemSnapshot dosa;
    private InventoryLine waterStock;
    private InventoryLine dosaStock;
    private Order lastSaved;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ledger = new ReservationLedger(clock, 8);
        orderProperties = new OrderProperties();
        checkoutService = new CheckoutServiceImpl(userAccountRepository, vendorRepository, menuItemSnapshotRepository,
                inventoryLineRepository, orderRepository, ledger, new OrderReservations(ledger), orderNumberGenerator,
                orderStore, orderCompletionService, paymentGatewayClient, orderMapper, orderProperties, clock);

        userId = UUID.randomUUID();

        vendor = new Vendor();
        vendor.setId(UUID.randomUUID());
        vendor.setName("Nescafe Stall");
        vendor.setOpen(true);

        water = snapshot("Water Bottle", ItemKind.RETAIL, "50", true);
        dosa = snapshot("Masala Dosa", ItemKind.PRODUCE, "30", false);

        waterStock = stock(water, 5, false);
        dosaStock = stock(dosa, 0, true);

        user = new UserAccount();
        user.setId(userId);
        user.setCartVendorId(vendor.getId());
        user.setCart(new ArrayList<>(List.of(
                new CartItem(water.getItemId(), ItemKind.RETAIL, 2),
                new CartItem(dosa.getItemId(), ItemKind.PRODUCE, 1))));

        when(userAccountRepository.findById(userId)).thenReturn(Optional.of(user));
        when(vendorRepository.findById(vendor.getId())).thenReturn(Optional.of(vendor));
        when(menuItemSnapshotRepository.findAllById(anyIterable())).thenReturn(List.of(water, dosa));
        when(inventoryLineRepository.findByVendorIdAndItemIdIn(eq(vendor.getId()), anyCollection()))
                .thenAnswer(i -> List.of(waterStock, dosaStock));
        when(orderNumberGenerator.next(vendor.getId(), userId)).thenReturn("CE-20261019-ABCD-00001");
        when(orderStore.createPending(any(Order.class))).thenAnswer(i -> {
            lastSaved = i.getArgument(0);
            return lastSaved;
        });
        when(orderMapper.toOrderResponse(any(Order.class))).thenAnswer(i -> {
            Order o = i.getArgument(0);
            return OrderResponse.builder().id(o.getId()).status(o.getStatus()).total(o.getTotal()).build();
        });
    }

    private MenuItemSnapshot snapshot(String name, ItemKind kind, String price, boolean packable) {
        MenuItemSnapshot snapshot = new MenuItemSnapshot();
        snapshot.setItemId(UUID.randomUUID());
        snapshot.setVendorId(vendor.getId());
        snapshot.setKind(kind);
        snapshot.setName(name);
        snapshot.setPrice(new BigDecimal(price));
        snapshot.setPackable(packable);
        return snapshot;
    }

    private InventoryLine stock(MenuItemSnapshot item, int quantity, boolean available) {
        InventoryLine line = new InventoryLine();
        line.setVendorId(vendor.getId());
        line.setItemId(item.getItemId());
        line.setKind(item.getKind());
        line.setQuantity(quantity);
        line.setAvailable(available);
        return line;
    }

    private CheckoutRequest request(OrderType orderType, PaymentMethod paymentMethod) {
        CheckoutRequest request = new CheckoutRequest();
        request.setOrderType(orderType);
        request.setPaymentMethod(paymentMethod);
        request.setCollectorName("Asha");
        return request;
    }

    private ReservationKey keyOf(MenuItemSnapshot item) {
        return new ReservationKey(vendor.getId(), item.getKind(), item.getItemId());
    }

    @Nested
    @DisplayName("Successful checkout")
    class SuccessTests {

        @Test
        void checkout_VendorApproval_ReservesUnderOrderIdAndSavesPendingOrder() {
            // Act
            CheckoutResponse response = checkoutService.checkout(userId,
                    request(OrderType.TAKEAWAY, PaymentMethod.VENDOR_APPROVAL));

            // Assert
            assertThat(lastSaved.getStatus()).isEqualTo(OrderStatus.PENDING_VENDOR_APPROVAL);
            assertThat(lastSaved.getOrderNumber()).isEqualTo("CE-20261019-ABCD-00001");
            assertThat(lastSaved.getReservationExpiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(30)));
            assertThat(lastSaved.getItems()).hasSize(2);

            String holder = OrderReservations.holderOf(lastSaved.getId());
            assertThat(ledger.isHeld(keyOf(water))).contains(holder);
            assertThat(ledger.isHeld(keyOf(dosa))).contains(holder);

            assertThat(response.getOrder().getId()).isEqualTo(lastSaved.getId());
            assertThat(response.getGatewayOrderId()).isNull();
            verifyNoInteractions(paymentGatewayClient);
        }

        @Test
        void checkout_Takeaway_ChargesPackagingPerPackableUnit() {
            // Act
            checkoutService.checkout(userId, request(OrderType.TAKEAWAY, PaymentMethod.VENDOR_APPROVAL));

            // Assert: 2 x 50 + 30, three packed units, platform fee
            assertThat(lastSaved.getItemsTotal()).isEqualByComparingTo("130");
            assertThat(lastSaved.getPackagingCharge()).isEqualByComparingTo("15");
            assertThat(lastSaved.getDeliveryCharge()).isEqualByComparingTo("0");
            assertThat(lastSaved.getTotal()).isEqualByComparingTo("147");
        }

        @Test
        void checkout_DineIn_HasNoPackagingCharge() {
            // Act
            checkoutService.checkout(userId, request(OrderType.DINE_IN, PaymentMethod.VENDOR_APPROVAL));

            // Assert
            assertThat(lastSaved.getPackagingCharge()).isEqualByComparingTo("0");
            assertThat(lastSaved.getTotal()).isEqualByComparingTo("132");
        }

        @Test
        void checkout_Delivery_AddsDeliveryChargeAndKeepsAddress() {
            // Arrange
            vendor.setOffersDelivery(true);
            CheckoutRequest request = request(OrderType.DELIVERY, PaymentMethod.VENDOR_APPROVAL);
            request.setAddress("Hostel 4, Room 212");

            // Act
            checkoutService.checkout(userId, request);

            // Assert
            assertThat(lastSaved.getDeliveryCharge()).isEqualByComparingTo("50");
            assertThat(lastSaved.getTotal()).isEqualByComparingTo("197");
            assertThat(lastSaved.getAddress()).isEqualTo("Hostel 4, Room 212");
        }

        @Test
        void checkout_Online_CreatesGatewayOrderInMinorUnits() {
            // Arrange
            GatewayOrderResponse gatewayOrder = new GatewayOrderResponse();
            gatewayOrder.setId("order_N1");
            gatewayOrder.setAmount(14700);
            gatewayOrder.setCurrency("INR");
            when(paymentGatewayClient.createOrder(anyLong(), anyString(), anyString())).thenReturn(gatewayOrder);
            when(paymentGatewayClient.getKeyId()).thenReturn("rzp_test_key");

            // Act
            CheckoutResponse response = checkoutService.checkout(userId,
                    request(OrderType.TAKEAWAY, PaymentMethod.ONLINE));

            // Assert
            assertThat(lastSaved.getStatus()).isEqualTo(OrderStatus.PENDING_PAYMENT);
            verify(paymentGatewayClient).createOrder(14700L, "INR", CheckoutServiceImpl.receiptFor(lastSaved.getId()));
            verify(orderStore).attachGatewayOrder(lastSaved.getId(), "order_N1");
            assertThat(response.getGatewayOrderId()).isEqualTo("order_N1");
            assertThat(response.getAmountInMinorUnits()).isEqualTo(14700L);
            assertThat(response.getGatewayKeyId()).isEqualTo("rzp_test_key");
        }

        @Test
        void checkout_WithdrawsOlderApprovalRequestsBeforeReserving() {
            // Act
            checkoutService.checkout(userId, request(OrderType.TAKEAWAY, PaymentMethod.CASH));

            // Assert
            InOrder inOrder = inOrder(orderCompletionService, inventoryLineRepository);
            inOrder.verify(orderCompletionService).cancelAllPendingApprovals(userId);
            inOrder.verify(inventoryLineRepository).findByVendorIdAndItemIdIn(eq(vendor.getId()), anyCollection());
        }
    }

    @Nested
    @DisplayName("Rejected checkout")
    class RejectionTests {

        @Test
        void checkout_ItemHeldByAnotherOrder_ThrowsConflictAndTakesNothing() {
            // Arrange
            ledger.acquire(List.of(ReservationRequest.exclusive(keyOf(dosa))), "other-order", Duration.ofMinutes(30));

            // Act & Assert
            assertThatThrownBy(() -> checkoutService.checkout(userId,
                    request(OrderType.TAKEAWAY, PaymentMethod.VENDOR_APPROVAL)))
                    .isInstanceOf(ReservationConflictException.class)
                    .satisfies(e -> assertThat(((ReservationConflictException) e).getUnavailableItems())
                            .containsExactly("Masala Dosa"));

            assertThat(ledger.isHeld(keyOf(water))).isEmpty();
            verify(orderStore, never()).createPending(any());
            verifyNoInteractions(orderNumberGenerator);
        }

        @Test
        void checkout_RetailStockShort_ThrowsConflict() {
            // Arrange
            waterStock.setQuantity(1);

            // Act & Assert
            assertThatThrownBy(() -> checkoutService.checkout(userId,
                    request(OrderType.TAKEAWAY, PaymentMethod.VENDOR_APPROVAL)))
                    .isInstanceOf(ReservationConflictException.class)
                    .hasMessageContaining("Water Bottle");
            assertThat(ledger.stats().getActiveClaims()).isZero();
        }

        @Test
        void checkout_ProduceMarkedUnavailable_ThrowsConflict() {
            // Arrange
            dosaStock.setAvailable(false);

            // Act & Assert
            assertThatThrownBy(() -> checkoutService.checkout(userId,
                    request(OrderType.TAKEAWAY, PaymentMethod.VENDOR_APPROVAL)))
                    .isInstanceOf(ReservationConflictException.class)
                    .hasMessageContaining("Masala Dosa");
        }

        @Test
        void checkout_EmptyCart_ThrowsIllegalArgument() {
            // Arrange
            user.getCart().clear();

            // Act & Assert
            assertThatThrownBy(() -> checkoutService.checkout(userId,
                    request(OrderType.TAKEAWAY, PaymentMethod.VENDOR_APPROVAL)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Cart is empty");
            verifyNoInteractions(orderStore);
        }

        @Test
        void checkout_DeliveryWithoutAddress_ThrowsIllegalArgument() {
            // Arrange
            vendor.setOffersDelivery(true);

            // Act & Assert
            assertThatThrownBy(() -> checkoutService.checkout(userId,
                    request(OrderType.DELIVERY, PaymentMethod.VENDOR_APPROVAL)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("address");
        }

        @Test
        void checkout_DeliveryFromVendorWithoutDelivery_ThrowsIllegalArgument() {
            // Arrange
            CheckoutRequest request = request(OrderType.DELIVERY, PaymentMethod.VENDOR_APPROVAL);
            request.setAddress("Hostel 4");

            // Act & Assert
            assertThatThrownBy(() -> checkoutService.checkout(userId, request))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("does not offer delivery");
        }

        @Test
        void checkout_ClosedVendor_ThrowsIllegalArgument() {
            // Arrange
            vendor.setOpen(false);

            // Act & Assert
            assertThatThrownBy(() -> checkoutService.checkout(userId,
                    request(OrderType.TAKEAWAY, PaymentMethod.VENDOR_APPROVAL)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(ledger.stats().getActiveClaims()).isZero();
        }

        @Test
        void checkout_QuantityAboveCap_ThrowsIllegalArgument() {
            // Arrange
            user.getCart().get(1).setQuantity(11);

            // Act & Assert
            assertThatThrownBy(() -> checkoutService.checkout(userId,
                    request(OrderType.TAKEAWAY, PaymentMethod.VENDOR_APPROVAL)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("between 1 and 10");
        }

        @Test
        void checkout_RawMaterial_ThrowsIllegalArgument() {
            // Arrange
            dosa.setKind(ItemKind.RAW_MATERIAL);

            // Act & Assert
            assertThatThrownBy(() -> checkoutService.checkout(userId,
                    request(OrderType.TAKEAWAY, PaymentMethod.VENDOR_APPROVAL)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("can't be ordered");
        }

        @Test
        void checkout_PaymentAlreadyPending_ThrowsInvalidOrderState() {
            // Arrange
            when(orderRepository.existsByUserIdAndStatusAndReservationExpiresAtAfter(
                    userId, OrderStatus.PENDING_PAYMENT, NOW)).thenReturn(true);

            // Act & Assert
            assertThatThrownBy(() -> checkoutService.checkout(userId,
                    request(OrderType.TAKEAWAY, PaymentMethod.ONLINE)))
                    .isInstanceOf(InvalidOrderStateException.class);
            assertThat(ledger.stats().getActiveClaims()).isZero();
        }
    }

    @Nested
    @DisplayName("Failures after reserving")
    class RollbackTests {

        @Test
        void checkout_OrderNumberUnavailable_ReleasesReservations() {
            // Arrange
            when(orderNumberGenerator.next(vendor.getId(), userId))
                    .thenThrow(new OrderNumberUnavailableException("down", new QueryTimeoutException("timeout")));

            // Act & Assert
            assertThatThrownBy(() -> checkoutService.checkout(userId,
                    request(OrderType.TAKEAWAY, PaymentMethod.VENDOR_APPROVAL)))
                    .isInstanceOf(OrderNumberUnavailableException.class);
            assertThat(ledger.stats().getActiveClaims()).isZero();
        }

        @Test
        void checkout_GatewayDown_FailsOrderAndReleasesReservations() {
            // Arrange
            when(paymentGatewayClient.createOrder(anyLong(), anyString(), anyString()))
                    .thenThrow(new ExternalServiceException("Payment gateway is unavailable"));
            when(orderStore.transition(any(UUID.class), anySet(), eq(OrderStatus.FAILED), anyString()))
                    .thenAnswer(i -> {
                        lastSaved.setStatus(OrderStatus.FAILED);
                        return Optional.of(lastSaved);
                    });

            // Act & Assert
            assertThatThrownBy(() -> checkoutService.checkout(userId,
                    request(OrderType.TAKEAWAY, PaymentMethod.ONLINE)))
                    .isInstanceOf(ExternalServiceException.class);

            ArgumentCaptor<UUID> orderId = ArgumentCaptor.forClass(UUID.class);
            verify(orderStore).transition(orderId.capture(), eq(EnumSet.of(OrderStatus.PENDING_PAYMENT)),
                    eq(OrderStatus.FAILED), eq("Payment gateway unavailable"));
            assertThat(orderId.getValue()).isEqualTo(lastSaved.getId());
            assertThat(ledger.stats().getActiveClaims()).isZero();
        }
    }

    @Test
    void receiptFor_StaysWithinGatewayLimit() {
        String receipt = CheckoutServiceImpl.receiptFor(UUID.fromString("123e4567-e89b-12d3-a456-426614174000"));

        assertThat(receipt).startsWith("rcpt_123e4567e89b");
        assertThat(receipt).hasSizeLessThanOrEqualTo(40);
        assertThat(receipt).doesNotContain("-");
    }
}
