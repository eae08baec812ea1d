package com.campuseats.orderservice.service;

import com.campuseats.common.exception.InsufficientStockException;
import com.campuseats.orderservice.config.OrderProperties;
import com.campuseats.orderservice.event.OrderEventPublisher;
import com.campuseats.orderservice.model.ItemKind;
import com.campuseats.orderservice.model.Order;
import com.campuseats.orderservice.model.OrderItem;
import com.campuseats.orderservice.model.OrderStatus;
import com.campuseats.orderservice.repository.InventoryLineRepository;
import com.campuseats.orderservice.repository.InventoryReportRepository;
import com.campuseats.orderservice.repository.OrderRepository;
import com.campuseats.orderservice.repository.UserAccountRepository;
import com.campuseats.orderservice.repository.VendorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Applies a confirmed order to durable inventory.
 *
 * <p>The first statement is the conditional move to IN_PROGRESS. Whoever loses that race
 * (a duplicate verification, a second accept click, the sweeper) gets an empty result and
 * touches nothing. The winner decrements stock with guarded updates, records the sale in the
 * day's report, links the order to the vendor and the user and clears the cart, all in one
 * transaction. Reservations are left alone; callers release them after the commit returns.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InventoryCommitter {

    private final OrderRepository orderRepository;
    private final InventoryLineRepository inventoryLineRepository;
    private final InventoryReportRepository inventoryReportRepository;
    private final UserAccountRepository userAccountRepository;
    private final VendorRepository vendorRepository;
    private final OrderEventPublisher eventPublisher;
    private final OrderProperties orderProperties;
    private final Clock clock;

    /**
     * @param paymentReference gateway payment id, null for cash and approval orders
     * @return the committed order, or empty if the order had already left {@code expected}
     * @throws InsufficientStockException if durable stock can't cover a line; nothing is written
     */
    @Transactional
    public Optional<Order> commit(UUID orderId, Set<OrderStatus> expected, String paymentReference) {
        Instant now = clock.instant();
        Optional<OrderStatus> previous = claim(orderId, expected, paymentReference, now);
        if (previous.isEmpty()) {
            log.info("Commit skipped, order is no longer pending: orderId={}", orderId);
            return Optional.empty();
        }

        Order order = orderRepository.findById(orderId).orElseThrow();
        LocalDate reportDate = LocalDate.ofInstant(now, ZoneOffset.UTC);

        // row locks in item id order, so two commits over the same lines can't deadlock
        List<OrderItem> lines = order.getItems().stream()
                .sorted(Comparator.comparing(OrderItem::getItemId))
                .collect(Collectors.toList());
        for (OrderItem item : lines) {
            switch (item.getKind()) {
                case RETAIL -> commitRetail(order, item, reportDate, now);
                case PRODUCE -> commitProduce(order, item, reportDate, now);
                case RAW_MATERIAL -> throw new IllegalStateException(
                        "Raw materials can't be sold: orderId=" + orderId + ", itemId=" + item.getItemId());
            }
        }

        vendorRepository.pushActiveOrder(order.getVendorId(), order.getId());
        userAccountRepository.pushActiveOrder(order.getUserId(), order.getId());
        userAccountRepository.deleteCartItems(order.getUserId());
        userAccountRepository.clearCartVendor(order.getUserId());

        eventPublisher.statusChanged(order, previous.get(), null);
        log.info("Order committed: orderId={}, orderNumber={}, items={}",
                order.getId(), order.getOrderNumber(), order.getItems().size());
        return Optional.of(order);
    }

    // one status at a time, so the event knows which pending state the order left
    private Optional<OrderStatus> claim(UUID orderId, Set<OrderStatus> expected, String paymentReference, Instant now) {
        for (OrderStatus from : expected) {
            Set<OrderStatus> single = EnumSet.of(from);
            int updated = paymentReference == null
                    ? orderRepository.transition(orderId, single, OrderStatus.IN_PROGRESS, now)
                    : orderRepository.transitionWithPayment(orderId, single, OrderStatus.IN_PROGRESS,
                            paymentReference, now);
            if (updated > 0) {
                return Optional.of(from);
            }
        }
        return Optional.empty();
    }

    private void commitRetail(Order order, OrderItem item, LocalDate reportDate, Instant now) {
        int rows = inventoryLineRepository.decreaseRetailQuantity(
                order.getVendorId(), item.getItemId(), item.getQuantity(), now);
        if (rows == 0) {
            log.error("Retail stock below reserved quantity: orderId={}, itemId={}, quantity={}",
                    order.getId(), item.getItemId(), item.getQuantity());
            throw new InsufficientStockException("Insufficient stock for " + item.getName());
        }

        int closing = inventoryLineRepository.findQuantity(order.getVendorId(), item.getItemId()).orElse(0);
        inventoryReportRepository.insertIfAbsent(order.getVendorId(), reportDate, item.getItemId(),
                ItemKind.RETAIL.name(), closing + item.getQuantity());
        inventoryReportRepository.recordRetailSale(order.getVendorId(), reportDate, item.getItemId(),
                item.getQuantity(), closing);
    }

    private void commitProduce(Order order, OrderItem item, LocalDate reportDate, Instant now) {
        boolean stillAvailable = !orderProperties.isProduceSoldOutOnCommit();
        int rows = inventoryLineRepository.sellProduce(order.getVendorId(), item.getItemId(), stillAvailable, now);
        if (rows == 0) {
            log.error("Produce no longer available: orderId={}, itemId={}", order.getId(), item.getItemId());
            throw new InsufficientStockException(item.getName() + " is no longer available");
        }

        inventoryReportRepository.insertIfAbsent(order.getVendorId(), reportDate, item.getItemId(),
                ItemKind.PRODUCE.name(), 0);
        inventoryReportRepository.recordProduceSale(order.getVendorId(), reportDate, item.getItemId(),
                item.getQuantity());
    }
}
