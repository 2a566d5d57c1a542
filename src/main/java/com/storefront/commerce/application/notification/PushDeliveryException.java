package com.storefront.commerce.application.notification;

import com.storefront.commerce.common.exception.ErrorCode;
import com.storefront.commerce.common.exception.SystemException;

/**
 * 푸시 게이트웨이 발송 실패
 *
 * 재시도 대상 예외이며 HTTP 응답으로는 노출되지 않는다.
 */
public class PushDeliveryException extends SystemException {

    public PushDeliveryException(String detail) {
        super(ErrorCode.PUSH_DELIVERY_FAILED, detail);
    }

    public PushDeliveryException(String detail, Throwable cause) {
        super(ErrorCode.PUSH_DELIVERY_FAILED, detail, cause);
    }
}
