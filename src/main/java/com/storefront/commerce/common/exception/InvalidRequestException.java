package com.storefront.commerce.common.exception;

/**
 * 요청 값 검증 실패 예외 (400)
 *
 * 누락되었거나 형식이 잘못된 필드를 메시지에 포함한다.
 * 예: "유효하지 않은 요청입니다 | shippingAddress.city는 필수입니다"
 */
public class InvalidRequestException extends DomainException {

    public InvalidRequestException(String detailMessage) {
        super(ErrorCode.INVALID_REQUEST, detailMessage);
    }
}
