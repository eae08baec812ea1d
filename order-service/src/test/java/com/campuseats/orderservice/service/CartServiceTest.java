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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CartServiceTest {

    @Mock
    private UserAccountRepository userAccountRepository;
    @Mock
    private MenuItemSnapshotRepository menuItemSnapshotRepository;
    @Mock
    private InventoryLineRepository inventoryLineRepository;
    @Mock
    private OrderCompletionService orderCompletionService;
    @Mock
    private OrderMapper orderMapper;

    private CartService cartService;

    private UserAccount user;
    private MenuItemSnapshot samosa;
    private InventoryLine samosaStock;

    @BeforeEach
    void setUp() {
        cartService = new CartService(userAccountRepository, menuItemSnapshotRepository, inventoryLineRepository,
                orderCompletionService, orderMapper, new OrderProperties());

        user = new UserAccount();
        user.setId(UUID.randomUUID());
        user.setCart(new ArrayList<>());

        samosa = new MenuItemSnapshot();
        samosa.setItemId(UUID.randomUUID());
        samosa.setVendorId(UUID.randomUUID());
        samosa.setKind(ItemKind.PRODUCE);
        samosa.setName("Samosa");
        samosa.setPrice(BigDecimal.valueOf(15));

        when(userAccountRepository.findById(user.getId())).thenReturn(Optional.of(user));
        when(userAccountRepository.save(any(UserAccount.class))).thenAnswer(i -> i.getArgument(0));
        when(menuItemSnapshotRepository.findById(samosa.getItemId())).thenReturn(Optional.of(samosa));

        samosaStock = new InventoryLine();
        samosaStock.setVendorId(samosa.getVendorId());
        samosaStock.setItemId(samosa.getItemId());
        samosaStock.setKind(ItemKind.PRODUCE);
        samosaStock.setAvailable(true);
        when(inventoryLineRepository.findByVendorIdAndItemId(samosa.getVendorId(), samosa.getItemId()))
                .thenReturn(Optional.of(samosaStock));
    }

    private CartItemRequest line(UUID itemId, int quantity) {
        CartItemRequest request = new CartItemRequest();
        request.setItemId(itemId);
        request.setQuantity(quantity);
        return request;
    }

    @Test
    void putItem_EmptyCart_AddsLineAndPinsVendor() {
        // Act
        CartResponse response = cartService.putItem(user.getId(), line(samosa.getItemId(), 2));

        // Assert
        assertThat(response.getVendorId()).isEqualTo(samosa.getVendorId());
        assertThat(user.getCart()).hasSize(1);
        assertThat(user.getCart().get(0).getQuantity()).isEqualTo(2);
        verify(orderCompletionService).cancelAllPendingApprovals(user.getId());
    }

    @Test
    void putItem_ExistingLine_ReplacesQuantity() {
        // Arrange
        user.setCartVendorId(samosa.getVendorId());
        user.getCart().add(new CartItem(samosa.getItemId(), ItemKind.PRODUCE, 1));

        // Act
        cartService.putItem(user.getId(), line(samosa.getItemId(), 4));

        // Assert
        assertThat(user.getCart()).hasSize(1);
        assertThat(user.getCart().get(0).getQuantity()).isEqualTo(4);
    }

    @Test
    void putItem_OtherVendor_ThrowsIllegalArgument() {
        // Arrange
        user.setCartVendorId(UUID.randomUUID());
        user.getCart().add(new CartItem(UUID.randomUUID(), ItemKind.RETAIL, 1));

        // Act & Assert
        assertThatThrownBy(() -> cartService.putItem(user.getId(), line(samosa.getItemId(), 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("one vendor");
        verify(userAccountRepository, never()).save(any());
        verify(orderCompletionService, never()).cancelAllPendingApprovals(user.getId());
    }

    @Test
    void putItem_RetailAboveStock_ThrowsWithoutWithdrawingApprovals() {
        // Arrange
        samosa.setKind(ItemKind.RETAIL);
        samosaStock.setKind(ItemKind.RETAIL);
        samosaStock.setQuantity(3);

        // Act & Assert
        assertThatThrownBy(() -> cartService.putItem(user.getId(), line(samosa.getItemId(), 4)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Only 3 unit(s) available");
        verify(orderCompletionService, never()).cancelAllPendingApprovals(any());
        assertThat(user.getCart()).isEmpty();
    }

    @Test
    void putItem_ProduceUnavailable_ThrowsIllegalArgument() {
        // Arrange
        samosaStock.setAvailable(false);

        // Act & Assert
        assertThatThrownBy(() -> cartService.putItem(user.getId(), line(samosa.getItemId(), 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Produce item is not available");
        verify(orderCompletionService, never()).cancelAllPendingApprovals(any());
    }

    @Test
    void putItem_NoInventoryLine_ThrowsResourceNotFound() {
        // Arrange
        when(inventoryLineRepository.findByVendorIdAndItemId(samosa.getVendorId(), samosa.getItemId()))
                .thenReturn(Optional.empty());

        // Act & Assert
        assertThatThrownBy(() -> cartService.putItem(user.getId(), line(samosa.getItemId(), 1)))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void putItem_AboveProduceCap_ThrowsIllegalArgument() {
        assertThatThrownBy(() -> cartService.putItem(user.getId(), line(samosa.getItemId(), 11)))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(orderCompletionService);
    }

    @Test
    void putItem_RawMaterial_ThrowsIllegalArgument() {
        // Arrange
        samosa.setKind(ItemKind.RAW_MATERIAL);

        // Act & Assert
        assertThatThrownBy(() -> cartService.putItem(user.getId(), line(samosa.getItemId(), 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void putItem_UnknownItem_ThrowsResourceNotFound() {
        assertThatThrownBy(() -> cartService.putItem(user.getId(), line(UUID.randomUUID(), 1)))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void removeItem_LastLine_UnpinsVendor() {
        // Arrange
        user.setCartVendorId(samosa.getVendorId());
        user.getCart().add(new CartItem(samosa.getItemId(), ItemKind.PRODUCE, 1));

        // Act
        CartResponse response = cartService.removeItem(user.getId(), samosa.getItemId());

        // Assert
        assertThat(response.getItems()).isEmpty();
        assertThat(response.getVendorId()).isNull();
        verify(orderCompletionService).cancelAllPendingApprovals(user.getId());
    }

    @Test
    void removeItem_NotInCart_ThrowsWithoutWithdrawingApprovals() {
        // Act & Assert
        assertThatThrownBy(() -> cartService.removeItem(user.getId(), UUID.randomUUID()))
                .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(orderCompletionService);
        verify(userAccountRepository, never()).save(any());
    }

    @Test
    void clearCart_WithdrawsPendingApprovals() {
        // Arrange
        user.setCartVendorId(samosa.getVendorId());
        user.getCart().addAll(List.of(new CartItem(samosa.getItemId(), ItemKind.PRODUCE, 1)));

        // Act
        cartService.clearCart(user.getId());

        // Assert
        assertThat(user.getCart()).isEmpty();
        assertThat(user.getCartVendorId()).isNull();
        verify(orderCompletionService).cancelAllPendingApprovals(user.getId());
    }
}
