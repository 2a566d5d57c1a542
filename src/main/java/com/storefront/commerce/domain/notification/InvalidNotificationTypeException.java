package com.storefront.commerce.domain.notification;

import com.storefront.commerce.common.exception.DomainException;
import com.storefront.commerce.common.exception.ErrorCode;

/**
 * 알림 유형 필터 값이 유효하지 않을 때 발생하는 예외 (400)
 */
public class InvalidNotificationTypeException extends DomainException {

    public InvalidNotificationTypeException(String requestedType) {
        super(ErrorCode.INVALID_NOTIFICATION_TYPE, "입력값: " + requestedType);
    }
}
