package com.storefront.commerce.domain.order;

import com.storefront.commerce.common.exception.DomainException;
import com.storefront.commerce.common.exception.ErrorCode;

/**
 * 주문을 찾을 수 없을 때 발생하는 예외 (404)
 *
 * 주문이 존재하지만 요청자 소유가 아닌 경우에도 동일하게 발생시켜
 * 다른 사용자의 주문 존재 여부를 노출하지 않는다.
 */
public class OrderNotFoundException extends DomainException {

    public OrderNotFoundException(Long orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "orderId=" + orderId);
    }
}
