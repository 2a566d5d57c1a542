package com.storefront.commerce.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 주문 생성 최종 결과
 *
 * notificationRecorded = false: 주문은 커밋되었으나 알림 저장에 실패 (알림 서브시스템 저하 상태)
 * notificationRecorded = null: 멱등성 키 재요청. 이번 요청에서는 알림을 기록하지 않았다.
 */
@Getter
@AllArgsConstructor
public class PlaceOrderResult {
    private final OrderResult order;
    private final Boolean notificationRecorded;
    private final boolean replayed;

    public static PlaceOrderResult created(OrderResult order, boolean notificationRecorded) {
        return new PlaceOrderResult(order, notificationRecorded, false);
    }

    public static PlaceOrderResult replayed(OrderResult order) {
        return new PlaceOrderResult(order, null, true);
    }
}
