package com.storefront.commerce.common.exception;

/**
 * BizException - 비즈니스 예외의 최상위 클래스
 *
 * 역할:
 * - 모든 비즈니스 예외의 기본 클래스
 * - ErrorCode를 통해 에러 코드, 기본 메시지, HTTP 상태 코드를 함께 보관
 *
 * 예외 계층:
 * BizException (최상위)
 * ├─ DomainException (검증 실패, 조회 실패, 비즈니스 규칙 위반)
 * ├─ ApplicationException (애플리케이션 처리 실패)
 * └─ SystemException (DB, 푸시 게이트웨이 등 의존 시스템 오류)
 */
public abstract class BizException extends RuntimeException {

    private final ErrorCode errorCode;

    protected BizException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, String detailMessage) {
        super(errorCode.getMessage() + " | " + detailMessage);
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode.getMessage() + " | " + detailMessage, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getStatusCode() {
        return errorCode.getStatusCode();
    }

    public String getErrorCodeValue() {
        return errorCode.getCode();
    }
}
