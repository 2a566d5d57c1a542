package com.storefront.commerce.domain.order;

import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * 주문 목록 조회 조건 (모든 필드 nullable, null이면 해당 조건 미적용)
 */
@Getter
@Builder
public class OrderSearchCondition {
    private final OrderStatus status;
    private final LocalDateTime startDate;
    private final LocalDateTime endDate;

    public static OrderSearchCondition none() {
        return OrderSearchCondition.builder().build();
    }
}
