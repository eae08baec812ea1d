package com.campuseats.orderservice.service;

import com.campuseats.common.exception.ResourceNotFoundException;
import com.campuseats.orderservice.config.OrderProperties;
import com.campuseats.orderservice.dto.CartItemRequest;
import com.campuseats.orderservice.dto.CartResponse;
import com.campuseats.orderservice.mapper.OrderMapper;
import com.campuseats.orderservice.model.CartItem;
import com.campuseats.orderservice.model.InventoryLine;
import com.campuseats.orderservice.model.ItemKind;
import com.campuseats.orderservice.model.MenuItemSnapshot;
import com.campuseats.orderservice.model.UserAccount;
import com.campuseats.orderservice.repository.InventoryLineRepository;
import com.campuseats.orderservice.repository.MenuItemSnapshotRepository;
import com.campuseats.orderservice.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Cart editing. A cart holds items of one vendor only. Any edit withdraws the user's open
 * approval requests, since the vendor would otherwise be deciding on a stale cart.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CartService {

    private final UserAccountRepository userAccountRepository;
    private final MenuItemSnapshotRepository menuItemSnapshotRepository;
    private final InventoryLineRepository inventoryLineRepository;
    private final OrderCompletionService orderCompletionService;
    private final OrderMapper orderMapper;
    private final OrderProperties orderProperties;

    public CartResponse getCart(UUID userId) {
        return toResponse(findUser(userId));
    }

    /**
     * Adds an item or replaces its quantity. Everything is checked before the user's open
     * approval requests are withdrawn, so a rejected edit changes nothing.
     */
    @Transactional
    public CartResponse putItem(UUID userId, CartItemRequest request) {
        MenuItemSnapshot snapshot = menuItemSnapshotRepository.findById(request.getItemId())
                .orElseThrow(() -> new ResourceNotFoundException("Item not found: " + request.getItemId()));

        int max = switch (snapshot.getKind()) {
            case RETAIL -> orderProperties.getMaxRetailQuantity();
            case PRODUCE -> orderProperties.getMaxProduceQuantity();
            case RAW_MATERIAL -> throw new IllegalArgumentException(snapshot.getName() + " can't be ordered");
        };
        if (request.getQuantity() > max) {
            throw new IllegalArgumentException("quantity of " + snapshot.getName() + " can't exceed " + max);
        }

        UserAccount user = findUser(userId);
        if (user.getCartVendorId() != null && !user.getCart().isEmpty()
                && !user.getCartVendorId().equals(snapshot.getVendorId())) {
            throw new IllegalArgumentException("Cart can only contain items from one vendor. Clear it first.");
        }
        checkStock(snapshot, request.getQuantity());

        orderCompletionService.cancelAllPendingApprovals(userId);

        Optional<CartItem> existing = user.getCart().stream()
                .filter(line -> line.getItemId().equals(snapshot.getItemId()))
                .findFirst();
        if (existing.isPresent()) {
            existing.get().setQuantity(request.getQuantity());
        } else {
            user.getCart().add(new CartItem(snapshot.getItemId(), snapshot.getKind(), request.getQuantity()));
        }
        user.setCartVendorId(snapshot.getVendorId());

        log.debug("Cart updated: userId={}, itemId={}, quantity={}", userId, snapshot.getItemId(), request.getQuantity());
        return toResponse(userAccountRepository.save(user));
    }

    @Transactional
    public CartResponse removeItem(UUID userId, UUID itemId) {
        UserAccount user = findUser(userId);
        if (user.getCart().stream().noneMatch(line -> line.getItemId().equals(itemId))) {
            throw new ResourceNotFoundException("Item not in cart: " + itemId);
        }

        orderCompletionService.cancelAllPendingApprovals(userId);

        user.getCart().removeIf(line -> line.getItemId().equals(itemId));
        if (user.getCart().isEmpty()) {
            user.setCartVendorId(null);
        }
        return toResponse(userAccountRepository.save(user));
    }

    @Transactional
    public void clearCart(UUID userId) {
        UserAccount user = findUser(userId);

        orderCompletionService.cancelAllPendingApprovals(userId);

        user.getCart().clear();
        user.setCartVendorId(null);
        userAccountRepository.save(user);
    }

    // Durable stock only; live reservations are checked at checkout
    private void checkStock(MenuItemSnapshot snapshot, int quantity) {
        InventoryLine line = inventoryLineRepository.findByVendorIdAndItemId(snapshot.getVendorId(), snapshot.getItemId())
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Item not found in vendor's inventory: " + snapshot.getItemId()));
        if (snapshot.getKind() == ItemKind.RETAIL && quantity > line.getQuantity()) {
            throw new IllegalArgumentException("Only " + line.getQuantity() + " unit(s) available");
        }
        if (snapshot.getKind() == ItemKind.PRODUCE && !line.isAvailable()) {
            throw new IllegalArgumentException("Produce item is not available");
        }
    }

    private UserAccount findUser(UUID userId) {
        return userAccountRepository.findById(userId)
                .orElseThrow(() -> {
                    log.warn("User not found: userId={}", userId);
                    return new ResourceNotFoundException("User not found with id: " + userId);
                });
    }

    private CartResponse toResponse(UserAccount user) {
        return CartResponse.builder()
                .userId(user.getId())
                .vendorId(user.getCartVendorId())
                .items(user.getCart().stream().map(orderMapper::toCartItemResponse).collect(Collectors.toList()))
                .build();
    }
}
