package com.campuseats.orderservice.service;

import com.campuseats.common.exception.ResourceNotFoundException;
import com.campuseats.orderservice.config.OrderProperties;
import com.campuseats.orderservice.dto.CheckoutRequest;
import com.campuseats.orderservice.dto.CheckoutResponse;
import com.campuseats.orderservice.exception.ExternalServiceException;
import com.campuseats.orderservice.exception.InvalidOrderStateException;
import com.campuseats.orderservice.exception.ReservationConflictException;
import com.campuseats.orderservice.gateway.GatewayOrderResponse;
import com.campuseats.orderservice.gateway.PaymentGatewayClient;
import com.campuseats.orderservice.mapper.OrderMapper;
import com.campuseats.orderservice.model.CartItem;
import com.campuseats.orderservice.model.InventoryLine;
import com.campuseats.orderservice.model.ItemKind;
import com.campuseats.orderservice.model.MenuItemSnapshot;
import com.campuseats.orderservice.model.Order;
import com.campuseats.orderservice.model.OrderItem;
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
import com.campuseats.orderservice.reservation.ReservationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Checkout runs in three phases:
 * <ol>
 *   <li>validation against the cart, the vendor and the menu snapshot, before any claim is taken;</li>
 *   <li>one all-or-nothing acquire on the reservation ledger, which never waits on the database;</li>
 *   <li>pricing, order number and persistence, then the gateway order for online payments.</li>
 * </ol>
 * Anything that fails after the acquire releases the claims again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckoutServiceImpl implements CheckoutService {

    private static final int RECEIPT_MAX_LENGTH = 40;

    private final UserAccountRepository userAccountRepository;
    private final VendorRepository vendorRepository;
    private final MenuItemSnapshotRepository menuItemSnapshotRepository;
    private final InventoryLineRepository inventoryLineRepository;
    private final OrderRepository orderRepository;
    private final ReservationLedger reservationLedger;
    private final OrderReservations orderReservations;
    private final OrderNumberGenerator orderNumberGenerator;
    private final OrderStore orderStore;
    private final OrderCompletionService orderCompletionService;
    private final PaymentGatewayClient paymentGatewayClient;
    private final OrderMapper orderMapper;
    private final OrderProperties orderProperties;
    private final Clock clock;

    @Override
    public CheckoutResponse checkout(UUID userId, CheckoutRequest request) {
        log.info("Checkout started: userId={}, orderType={}, paymentMethod={}",
                userId, request.getOrderType(), request.getPaymentMethod());

        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> {
                    log.warn("User not found: userId={}", userId);
                    return new ResourceNotFoundException("User not found with id: " + userId);
                });

        if (user.getCart() == null || user.getCart().isEmpty() || user.getCartVendorId() == null) {
            throw new IllegalArgumentException("Cart is empty");
        }

        Vendor vendor = vendorRepository.findById(user.getCartVendorId())
                .orElseThrow(() -> new ResourceNotFoundException("Vendor not found with id: " + user.getCartVendorId()));
        validateOrderType(request, vendor);

        Map<UUID, MenuItemSnapshot> snapshots = loadSnapshots(user.getCart());
        List<OrderItem> items = buildItems(user.getCart(), snapshots, vendor.getId());

        guardPendingOrders(userId, request.getPaymentMethod());

        UUID orderId = UUID.randomUUID();
        List<ReservationKey> keys = reserve(orderId, vendor.getId(), items, snapshots);

        Order saved;
        try {
            saved = orderStore.createPending(buildOrder(orderId, userId, vendor.getId(), items, request));
        } catch (RuntimeException e) {
            log.warn("Checkout failed after reserving, releasing: orderId={}, error={}", orderId, e.getMessage());
            orderReservations.release(orderId, keys);
            throw e;
        }

        CheckoutResponse.CheckoutResponseBuilder response = CheckoutResponse.builder();
        if (saved.getPaymentMethod() == PaymentMethod.ONLINE) {
            GatewayOrderResponse gatewayOrder = createGatewayOrder(saved);
            saved.setGatewayOrderId(gatewayOrder.getId());
            response.gatewayOrderId(gatewayOrder.getId())
                    .amountInMinorUnits(gatewayOrder.getAmount())
                    .currency(gatewayOrder.getCurrency())
                    .gatewayKeyId(paymentGatewayClient.getKeyId());
        }

        log.info("Checkout completed: orderId={}, orderNumber={}, status={}, total={}",
                saved.getId(), saved.getOrderNumber(), saved.getStatus(), saved.getTotal());
        return response.order(orderMapper.toOrderResponse(saved)).build();
    }

    private void validateOrderType(CheckoutRequest request, Vendor vendor) {
        if (!vendor.isOpen()) {
            throw new IllegalArgumentException(vendor.getName() + " is not accepting orders right now");
        }
        if (request.getOrderType() == OrderType.DELIVERY) {
            if (request.getAddress() == null || request.getAddress().isBlank()) {
                throw new IllegalArgumentException("address is required for delivery orders");
            }
            if (!vendor.isOffersDelivery()) {
                throw new IllegalArgumentException(vendor.getName() + " does not offer delivery");
            }
        }
    }

    private Map<UUID, MenuItemSnapshot> loadSnapshots(List<CartItem> cart) {
        List<UUID> itemIds = cart.stream().map(CartItem::getItemId).collect(Collectors.toList());
        return menuItemSnapshotRepository.findAllById(itemIds).stream()
                .collect(Collectors.toMap(MenuItemSnapshot::getItemId, Function.identity()));
    }

    private List<OrderItem> buildItems(List<CartItem> cart, Map<UUID, MenuItemSnapshot> snapshots, UUID vendorId) {
        List<OrderItem> items = new ArrayList<>();
        for (CartItem line : cart) {
            MenuItemSnapshot snapshot = snapshots.get(line.getItemId());
            if (snapshot == null) {
                log.warn("Cart item not found in menu snapshot: itemId={}", line.getItemId());
                throw new ResourceNotFoundException("Item not found: " + line.getItemId());
            }
            if (!snapshot.getVendorId().equals(vendorId)) {
                log.warn("Cart item belongs to different vendor: itemId={}, expectedVendorId={}, actualVendorId={}",
                        line.getItemId(), vendorId, snapshot.getVendorId());
                throw new IllegalArgumentException("Item " + snapshot.getName() + " does not belong to this vendor");
            }
            checkQuantity(snapshot, line.getQuantity());

            OrderItem item = new OrderItem();
            item.setItemId(snapshot.getItemId());
            item.setKind(snapshot.getKind());
            item.setName(snapshot.getName());
            item.setUnitPrice(snapshot.getPrice());
            item.setQuantity(line.getQuantity());
            // produce always goes out packed
            item.setPackable(snapshot.getKind() == ItemKind.PRODUCE || snapshot.isPackable());
            items.add(item);
        }
        return items;
    }

    private void checkQuantity(MenuItemSnapshot snapshot, Integer quantity) {
        int max = switch (snapshot.getKind()) {
            case RETAIL -> orderProperties.getMaxRetailQuantity();
            case PRODUCE -> orderProperties.getMaxProduceQuantity();
            case RAW_MATERIAL -> throw new IllegalArgumentException(snapshot.getName() + " can't be ordered");
        };
        if (quantity == null || quantity < 1 || quantity > max) {
            throw new IllegalArgumentException(
                    "quantity of " + snapshot.getName() + " must be between 1 and " + max);
        }
    }

    private void guardPendingOrders(UUID userId, PaymentMethod paymentMethod) {
        if (paymentMethod != PaymentMethod.VENDOR_APPROVAL
                && orderRepository.existsByUserIdAndStatusAndReservationExpiresAtAfter(
                        userId, OrderStatus.PENDING_PAYMENT, clock.instant())) {
            log.warn("Checkout rejected, payment already pending: userId={}", userId);
            throw new InvalidOrderStateException("You already have an order awaiting payment");
        }
        // last request wins: older approval requests would hold the same stock
        orderCompletionService.cancelAllPendingApprovals(userId);
    }

    private List<ReservationKey> reserve(UUID orderId, UUID vendorId, List<OrderItem> items,
            Map<UUID, MenuItemSnapshot> snapshots) {
        List<UUID> itemIds = items.stream().map(OrderItem::getItemId).collect(Collectors.toList());
        Map<UUID, InventoryLine> lines = inventoryLineRepository.findByVendorIdAndItemIdIn(vendorId, itemIds).stream()
                .collect(Collectors.toMap(InventoryLine::getItemId, Function.identity()));

        List<ReservationRequest> requests = new ArrayList<>();
        List<String> unavailable = new ArrayList<>();
        for (OrderItem item : items) {
            InventoryLine line = lines.get(item.getItemId());
            ReservationKey key = OrderReservations.keyOf(vendorId, item);
            if (line == null) {
                unavailable.add(item.getName());
                continue;
            }
            switch (item.getKind()) {
                case RETAIL -> requests.add(ReservationRequest.counted(key, item.getQuantity(), line.getQuantity()));
                case PRODUCE -> {
                    if (line.isAvailable()) {
                        requests.add(ReservationRequest.exclusive(key));
                    } else {
                        unavailable.add(item.getName());
                    }
                }
                case RAW_MATERIAL -> unavailable.add(item.getName());
            }
        }
        if (!unavailable.isEmpty()) {
            log.info("Checkout rejected, items out of stock: orderId={}, items={}", orderId, unavailable);
            throw new ReservationConflictException(unavailable);
        }

        ReservationResult result = reservationLedger.acquire(requests, OrderReservations.holderOf(orderId),
                orderProperties.getReservationTtl());
        if (!result.isGranted()) {
            List<String> names = result.getConflicts().stream()
                    .map(key -> snapshots.get(key.getItemId()).getName())
                    .collect(Collectors.toList());
            log.info("Checkout rejected, items reserved by other orders: orderId={}, items={}", orderId, names);
            throw new ReservationConflictException(names);
        }
        return requests.stream().map(ReservationRequest::getKey).collect(Collectors.toList());
    }

    private Order buildOrder(UUID orderId, UUID userId, UUID vendorId, List<OrderItem> items,
            CheckoutRequest request) {
        Instant now = clock.instant();
        OrderType orderType = request.getOrderType();

        BigDecimal itemsTotal = BigDecimal.ZERO;
        int packableUnits = 0;
        for (OrderItem item : items) {
            itemsTotal = itemsTotal.add(item.lineTotal());
            if (item.isPackable()) {
                packableUnits += item.getQuantity();
            }
        }
        BigDecimal packaging = orderType == OrderType.DINE_IN
                ? BigDecimal.ZERO
                : orderProperties.getPackagingCharge().multiply(BigDecimal.valueOf(packableUnits));
        BigDecimal delivery = orderType == OrderType.DELIVERY ? orderProperties.getDeliveryCharge() : BigDecimal.ZERO;
        BigDecimal platformFee = orderProperties.getPlatformFee();

        Order order = new Order();
        order.setId(orderId);
        order.setOrderNumber(orderNumberGenerator.next(vendorId, userId));
        order.setUserId(userId);
        order.setVendorId(vendorId);
        items.forEach(order::addItem);
        order.setItemsTotal(itemsTotal);
        order.setPackagingCharge(packaging);
        order.setDeliveryCharge(delivery);
        order.setPlatformFee(platformFee);
        order.setTotal(itemsTotal.add(packaging).add(delivery).add(platformFee));
        order.setOrderType(orderType);
        order.setPaymentMethod(request.getPaymentMethod());
        order.setCollectorName(request.getCollectorName());
        order.setCollectorPhone(request.getCollectorPhone());
        order.setAddress(orderType == OrderType.DELIVERY ? request.getAddress() : null);
        order.setStatus(request.getPaymentMethod() == PaymentMethod.VENDOR_APPROVAL
                ? OrderStatus.PENDING_VENDOR_APPROVAL
                : OrderStatus.PENDING_PAYMENT);
        order.setReservationExpiresAt(now.plus(orderProperties.getReservationTtl()));
        return order;
    }

    private GatewayOrderResponse createGatewayOrder(Order order) {
        long amount = order.getTotal().movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
        try {
            GatewayOrderResponse gatewayOrder = paymentGatewayClient.createOrder(amount,
                    orderProperties.getCurrency(), receiptFor(order.getId()));
            orderStore.attachGatewayOrder(order.getId(), gatewayOrder.getId());
            return gatewayOrder;
        } catch (ExternalServiceException e) {
            log.error("Gateway order creation failed, failing order: orderId={}", order.getId());
            orderStore.transition(order.getId(), EnumSet.of(OrderStatus.PENDING_PAYMENT), OrderStatus.FAILED,
                            "Payment gateway unavailable")
                    .ifPresent(orderReservations::release);
            throw e;
        }
    }

    // The receipt is derived from the order id so a retried gateway call can't open a second payment
    static String receiptFor(UUID orderId) {
        String receipt = "rcpt_" + orderId.toString().replace("-", "");
        return receipt.length() > RECEIPT_MAX_LENGTH ? receipt.substring(0, RECEIPT_MAX_LENGTH) : receipt;
    }
}
