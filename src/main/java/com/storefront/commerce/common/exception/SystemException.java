package com.storefront.commerce.common.exception;

/**
 * SystemException - 시스템/인프라 계층 오류 예외
 *
 * 역할:
 * - 데이터베이스, 외부 푸시 게이트웨이 등 의존 시스템 오류
 * - 항상 서버 오류(5XX)로 응답
 *
 * 사용 예:
 * - DATABASE_ERROR: 트랜잭션 도중 DB 오류
 * - PushDeliveryException: 푸시 발송 실패 (응답으로는 노출되지 않음)
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public SystemException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
