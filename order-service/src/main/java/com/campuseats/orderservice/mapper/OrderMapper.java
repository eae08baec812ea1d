package com.campuseats.orderservice.mapper;

import com.campuseats.orderservice.dto.CartItemResponse;
import com.campuseats.orderservice.dto.OrderItemResponse;
import com.campuseats.orderservice.dto.OrderResponse;
import com.campuseats.orderservice.model.CartItem;
import com.campuseats.orderservice.model.Order;
import com.campuseats.orderservice.model.OrderItem;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    OrderResponse toOrderResponse(Order order);

    List<OrderResponse> toOrderResponses(List<Order> orders);

    OrderItemResponse toOrderItemResponse(OrderItem orderItem);

    CartItemResponse toCartItemResponse(CartItem cartItem);

    // Orders are never built from requests here: prices and names come from the
    // menu snapshot, so the service assembles them
}
