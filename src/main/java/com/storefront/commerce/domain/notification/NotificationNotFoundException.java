package com.storefront.commerce.domain.notification;

import com.storefront.commerce.common.exception.DomainException;
import com.storefront.commerce.common.exception.ErrorCode;

/**
 * 알림이 없거나 요청자 소유가 아닐 때 발생하는 예외 (404)
 */
public class NotificationNotFoundException extends DomainException {

    public NotificationNotFoundException(Long notificationId) {
        super(ErrorCode.NOTIFICATION_NOT_FOUND, "notificationId=" + notificationId);
    }
}
