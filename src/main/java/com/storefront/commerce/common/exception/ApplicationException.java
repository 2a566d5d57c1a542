package com.storefront.commerce.common.exception;

/**
 * ApplicationException - 애플리케이션 계층 처리 실패 예외
 *
 * 도메인 규칙은 만족했지만 유스케이스 진행 중 처리에 실패한 경우 사용한다.
 * 서버 오류(5XX)로 응답한다.
 */
public class ApplicationException extends BizException {

    public ApplicationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ApplicationException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
