package com.storefront.commerce.domain.order;

import com.storefront.commerce.common.exception.DomainException;
import com.storefront.commerce.common.exception.ErrorCode;

/**
 * 결제 상태 값이 유효하지 않을 때 발생하는 예외 (400 Bad Request)
 */
public class InvalidPaymentStatusException extends DomainException {

    public InvalidPaymentStatusException(String requestedStatus) {
        super(ErrorCode.INVALID_PAYMENT_STATUS, "입력값: " + requestedStatus);
    }
}
