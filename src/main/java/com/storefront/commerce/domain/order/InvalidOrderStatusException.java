package com.storefront.commerce.domain.order;

import com.storefront.commerce.common.exception.DomainException;
import com.storefront.commerce.common.exception.ErrorCode;

/**
 * 주문 상태 값이 유효하지 않을 때 발생하는 예외 (400 Bad Request)
 */
public class InvalidOrderStatusException extends DomainException {

    public InvalidOrderStatusException(String requestedStatus) {
        super(ErrorCode.INVALID_ORDER_STATUS, "입력값: " + requestedStatus);
    }
}
