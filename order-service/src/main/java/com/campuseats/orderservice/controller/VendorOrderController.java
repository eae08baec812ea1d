package com.campuseats.orderservice.controller;

import com.campuseats.common.exception.AccessDeniedException;
import com.campuseats.orderservice.dto.OrderResponse;
import com.campuseats.orderservice.service.OrderService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/vendors/{vendorId}/orders")
@RequiredArgsConstructor
public class VendorOrderController {

    private final OrderService orderService;

    @GetMapping("/pending-approval")
    public ResponseEntity<List<OrderResponse>> getPendingApprovals(
            @PathVariable UUID vendorId,
            @RequestHeader(IdentityHeaders.VENDOR_ID) UUID callerVendorId) {
        requireSameVendor(vendorId, callerVendorId);
        return ResponseEntity.ok(orderService.getPendingApprovals(vendorId));
    }

    @GetMapping("/active")
    public ResponseEntity<List<OrderResponse>> getActiveOrders(
            @PathVariable UUID vendorId,
            @RequestHeader(IdentityHeaders.VENDOR_ID) UUID callerVendorId) {
        requireSameVendor(vendorId, callerVendorId);
        return ResponseEntity.ok(orderService.getActiveOrders(vendorId));
    }

    @GetMapping("/awaiting-cash")
    public ResponseEntity<List<OrderResponse>> getAwaitingCashPayment(
            @PathVariable UUID vendorId,
            @RequestHeader(IdentityHeaders.VENDOR_ID) UUID callerVendorId) {
        requireSameVendor(vendorId, callerVendorId);
        return ResponseEntity.ok(orderService.getAwaitingCashPayment(vendorId));
    }

    @GetMapping("/past")
    public ResponseEntity<List<OrderResponse>> getPastOrders(
            @PathVariable UUID vendorId,
            @RequestHeader(IdentityHeaders.VENDOR_ID) UUID callerVendorId) {
        requireSameVendor(vendorId, callerVendorId);
        return ResponseEntity.ok(orderService.getPastOrders(vendorId));
    }

    private void requireSameVendor(UUID vendorId, UUID callerVendorId) {
        if (!vendorId.equals(callerVendorId)) {
            throw new AccessDeniedException("Access Denied: You can only view your own orders");
        }
    }
}
