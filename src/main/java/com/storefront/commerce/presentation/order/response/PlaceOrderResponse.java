package com.storefront.commerce.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 생성 응답
 *
 * 주문 필드를 최상위에 펼치고 알림 기록 여부를 덧붙인다.
 * notification_recorded=false 는 주문은 확정되었지만 인앱 알림 저장에 실패했음을 뜻한다.
 * 멱등성 키 재요청 응답에는 notification_recorded가 없다.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderResponse {
    @JsonUnwrapped
    private OrderResponse order;

    @JsonProperty("notification_recorded")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Boolean notificationRecorded;
}
