package com.storefront.commerce.application.cart.dto;

import com.storefront.commerce.domain.cart.Cart;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 장바구니 결과 (Application layer 내부 DTO)
 */
@Getter
@Builder
@AllArgsConstructor
public class CartResult {
    private final Long cartId;
    private final Long userId;
    private final Integer totalItems;
    private final BigDecimal totalPrice;
    private final List<CartItemResult> items;
    private final LocalDateTime updatedAt;

    public static CartResult from(Cart cart, List<CartItemResult> items) {
        return CartResult.builder()
                .cartId(cart.getCartId())
                .userId(cart.getUserId())
                .totalItems(cart.getTotalItems())
                .totalPrice(cart.getTotalPrice())
                .items(items)
                .updatedAt(cart.getUpdatedAt())
                .build();
    }
}
