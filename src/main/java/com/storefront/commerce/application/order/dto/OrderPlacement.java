package com.storefront.commerce.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 주문 생성 트랜잭션 결과
 *
 * replayed = true: 같은 멱등성 키로 이미 생성된 주문을 그대로 반환한 경우 (재고/장바구니/알림 변경 없음)
 */
@Getter
@AllArgsConstructor
public class OrderPlacement {
    private final OrderResult order;
    private final boolean replayed;

    public static OrderPlacement created(OrderResult order) {
        return new OrderPlacement(order, false);
    }

    public static OrderPlacement replayed(OrderResult order) {
        return new OrderPlacement(order, true);
    }
}
