package com.storefront.commerce.domain.order;

import lombok.Getter;

/**
 * OrderStatus - 도메인 값 객체 (Enum)
 *
 * 주문의 생명주기 상태를 나타냅니다.
 * - PENDING: 주문 생성됨 (초기 상태)
 * - PROCESSING: 처리 중
 * - SHIPPED: 배송 중
 * - DELIVERED: 배송 완료
 * - CANCELLED: 주문 취소
 *
 * API에서는 소문자 값(pending, shipped ...)으로 주고받는다.
 */
@Getter
public enum OrderStatus {
    PENDING("pending", "주문 대기"),
    PROCESSING("processing", "처리 중"),
    SHIPPED("shipped", "배송 중"),
    DELIVERED("delivered", "배송 완료"),
    CANCELLED("cancelled", "주문 취소");

    private final String value;
    private final String displayName;

    OrderStatus(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    /**
     * 문자열에서 OrderStatus로 변환 (대소문자 무시)
     *
     * @throws InvalidOrderStatusException 다섯 가지 상태 중 어느 것도 아닌 경우
     */
    public static OrderStatus fromString(String status) {
        if (status == null || status.isBlank()) {
            throw new InvalidOrderStatusException(status);
        }
        for (OrderStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(status.trim())) {
                return candidate;
            }
        }
        throw new InvalidOrderStatusException(status);
    }
}
