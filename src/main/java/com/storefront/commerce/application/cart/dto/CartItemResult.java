package com.storefront.commerce.application.cart.dto;

import com.storefront.commerce.domain.cart.CartItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * 장바구니 항목 결과
 *
 * unitPrice는 담을 당시의 판매가이며, 주문 시 이 가격으로 주문 항목이 만들어진다.
 */
@Getter
@Builder
@AllArgsConstructor
public class CartItemResult {
    private final Long cartItemId;
    private final Long productId;
    private final String productName;
    private final Integer quantity;
    private final BigDecimal unitPrice;
    private final BigDecimal subtotal;

    public static CartItemResult from(CartItem item, String productName) {
        return CartItemResult.builder()
                .cartItemId(item.getCartItemId())
                .productId(item.getProductId())
                .productName(productName)
                .quantity(item.getQuantity())
                .unitPrice(item.getUnitPrice())
                .subtotal(item.getSubtotal())
                .build();
    }
}
