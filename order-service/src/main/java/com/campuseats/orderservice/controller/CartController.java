package com.campuseats.orderservice.controller;

import com.campuseats.orderservice.dto.CartItemRequest;
import com.campuseats.orderservice.dto.CartResponse;
import com.campuseats.orderservice.service.CartService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/cart")
@RequiredArgsConstructor
public class CartController {

    private final CartService cartService;

    @GetMapping
    public ResponseEntity<CartResponse> getCart(@RequestHeader(IdentityHeaders.USER_ID) UUID userId) {
        return ResponseEntity.ok(cartService.getCart(userId));
    }

    @PutMapping("/items")
    public ResponseEntity<CartResponse> putItem(
            @Valid @RequestBody CartItemRequest request,
            @RequestHeader(IdentityHeaders.USER_ID) UUID userId) {
        return ResponseEntity.ok(cartService.putItem(userId, request));
    }

    @DeleteMapping("/items/{itemId}")
    public ResponseEntity<CartResponse> removeItem(
            @PathVariable UUID itemId,
            @RequestHeader(IdentityHeaders.USER_ID) UUID userId) {
        return ResponseEntity.ok(cartService.removeItem(userId, itemId));
    }

    @DeleteMapping
    public ResponseEntity<Void> clearCart(@RequestHeader(IdentityHeaders.USER_ID) UUID userId) {
        cartService.clearCart(userId);
        return ResponseEntity.noContent().build();
    }
}
