package com.storefront.commerce.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 생성 커맨드 (Application 계층)
 *
 * 주문 항목은 요청에 포함되지 않으며 사용자의 장바구니에서 가져온다.
 * checkoutKey는 Idempotency-Key 헤더 값 (nullable)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderCommand {
    private ShippingAddressCommand shippingAddress;
    private String paymentMethod;
    private String note;
    private String checkoutKey;

    public boolean hasCheckoutKey() {
        return checkoutKey != null && !checkoutKey.isBlank();
    }
}
