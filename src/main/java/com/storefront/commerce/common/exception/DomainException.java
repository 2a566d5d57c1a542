package com.storefront.commerce.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 역할:
 * - 요청 검증 실패, 리소스 조회 실패, 비즈니스 규칙 위반 시 발생
 * - 변경 작업이 시작되기 전에 감지되며 클라이언트 오류(4XX)로 응답
 *
 * 사용 예:
 * - OrderNotFoundException: 주문이 없거나 요청자 소유가 아님
 * - InsufficientStockException: 재고 부족
 * - EmptyCartException: 빈 장바구니로 주문 시도
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
