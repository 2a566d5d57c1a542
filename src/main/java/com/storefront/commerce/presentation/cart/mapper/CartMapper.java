package com.storefront.commerce.presentation.cart.mapper;

import com.storefront.commerce.application.cart.dto.AddCartItemCommand;
import com.storefront.commerce.application.cart.dto.CartItemResult;
import com.storefront.commerce.application.cart.dto.CartResult;
import com.storefront.commerce.presentation.cart.request.AddCartItemRequest;
import com.storefront.commerce.presentation.cart.response.CartItemResponse;
import com.storefront.commerce.presentation.cart.response.CartResponse;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * CartMapper - Presentation layer와 Application layer 간의 DTO 변환
 */
@Component
public class CartMapper {

    public AddCartItemCommand toAddCartItemCommand(AddCartItemRequest request) {
        if (request == null) {
            return null;
        }
        return AddCartItemCommand.builder()
                .productId(request.getProductId())
                .quantity(request.getQuantity())
                .build();
    }

    public CartResponse toCartResponse(CartResult cart) {
        return CartResponse.builder()
                .cartId(cart.getCartId())
                .userId(cart.getUserId())
                .totalItems(cart.getTotalItems())
                .totalPrice(cart.getTotalPrice())
                .items(cart.getItems().stream()
                        .map(this::toCartItemResponse)
                        .collect(Collectors.toList()))
                .updatedAt(cart.getUpdatedAt())
                .build();
    }

    private CartItemResponse toCartItemResponse(CartItemResult item) {
        return CartItemResponse.builder()
                .cartItemId(item.getCartItemId())
                .productId(item.getProductId())
                .productName(item.getProductName())
                .quantity(item.getQuantity())
                .unitPrice(item.getUnitPrice())
                .subtotal(item.getSubtotal())
                .build();
    }
}
