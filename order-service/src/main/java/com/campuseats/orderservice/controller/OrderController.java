package com.campuseats.orderservice.controller;

import com.campuseats.orderservice.dto.DenyOrderRequest;
import com.campuseats.orderservice.dto.OrderResponse;
import com.campuseats.orderservice.service.OrderCompletionService;
import com.campuseats.orderservice.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;
    private final OrderCompletionService orderCompletionService;

    @GetMapping("/my-orders")
    public ResponseEntity<List<OrderResponse>> getMyOrders(@RequestHeader(IdentityHeaders.USER_ID) UUID userId) {
        return ResponseEntity.ok(orderService.getMyOrders(userId));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrderById(
            @PathVariable UUID orderId,
            @RequestHeader(value = IdentityHeaders.USER_ID, required = false) UUID userId,
            @RequestHeader(value = IdentityHeaders.VENDOR_ID, required = false) UUID vendorId) {
        return ResponseEntity.ok(orderService.getOrderById(orderId, userId, vendorId));
    }

    // --- user actions ---

    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @PathVariable UUID orderId,
            @RequestHeader(IdentityHeaders.USER_ID) UUID userId) {
        return ResponseEntity.ok(orderCompletionService.cancelOrder(orderId, userId));
    }

    @PostMapping("/cancel-pending")
    public ResponseEntity<Map<String, Integer>> cancelPendingApprovals(
            @RequestHeader(IdentityHeaders.USER_ID) UUID userId) {
        int withdrawn = orderCompletionService.cancelAllPendingApprovals(userId);
        return ResponseEntity.ok(Map.of("cancelled", withdrawn));
    }

    // --- vendor actions ---

    @PostMapping("/{orderId}/accept")
    public ResponseEntity<OrderResponse> acceptOrder(
            @PathVariable UUID orderId,
            @RequestHeader(IdentityHeaders.VENDOR_ID) UUID vendorId) {
        return ResponseEntity.ok(orderCompletionService.acceptOrder(orderId, vendorId));
    }

    @PostMapping("/{orderId}/deny")
    public ResponseEntity<OrderResponse> denyOrder(
            @PathVariable UUID orderId,
            @RequestHeader(IdentityHeaders.VENDOR_ID) UUID vendorId,
            @Valid @RequestBody(required = false) DenyOrderRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(orderCompletionService.denyOrder(orderId, vendorId, reason));
    }

    @PostMapping("/{orderId}/cash-confirmation")
    public ResponseEntity<OrderResponse> confirmCashPayment(
            @PathVariable UUID orderId,
            @RequestHeader(IdentityHeaders.VENDOR_ID) UUID vendorId) {
        return ResponseEntity.ok(orderCompletionService.confirmCashPayment(orderId, vendorId));
    }

    @PostMapping("/{orderId}/ready")
    public ResponseEntity<OrderResponse> markReady(
            @PathVariable UUID orderId,
            @RequestHeader(IdentityHeaders.VENDOR_ID) UUID vendorId) {
        return ResponseEntity.ok(orderService.markReady(orderId, vendorId));
    }

    @PostMapping("/{orderId}/complete")
    public ResponseEntity<OrderResponse> completeOrder(
            @PathVariable UUID orderId,
            @RequestHeader(IdentityHeaders.VENDOR_ID) UUID vendorId) {
        return ResponseEntity.ok(orderService.completeOrder(orderId, vendorId));
    }

    @PostMapping("/{orderId}/start-delivery")
    public ResponseEntity<OrderResponse> startDelivery(
            @PathVariable UUID orderId,
            @RequestHeader(IdentityHeaders.VENDOR_ID) UUID vendorId) {
        return ResponseEntity.ok(orderService.startDelivery(orderId, vendorId));
    }

    @PostMapping("/{orderId}/deliver")
    public ResponseEntity<OrderResponse> deliverOrder(
            @PathVariable UUID orderId,
            @RequestHeader(IdentityHeaders.VENDOR_ID) UUID vendorId) {
        return ResponseEntity.ok(orderService.deliverOrder(orderId, vendorId));
    }

    @PostMapping("/{orderId}/archive")
    public ResponseEntity<Void> archiveOrder(
            @PathVariable UUID orderId,
            @RequestHeader(IdentityHeaders.VENDOR_ID) UUID vendorId) {
        orderService.archiveOrder(orderId, vendorId);
        return ResponseEntity.noContent().build();
    }
}
