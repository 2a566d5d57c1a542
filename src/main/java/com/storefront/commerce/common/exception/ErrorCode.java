package com.storefront.commerce.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 기본 메시지 정의
 * - HTTP 상태 코드 매핑
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_ORDER_NOT_FOUND, SYSTEM_DATABASE_ERROR
 */
public enum ErrorCode {

    // ========== Request Validation (400) ==========

    INVALID_REQUEST("DOMAIN_REQUEST_INVALID", "유효하지 않은 요청입니다", 400),

    // User Domain
    USER_NOT_FOUND("DOMAIN_USER_NOT_FOUND", "사용자를 찾을 수 없습니다", 404),

    // Product Domain
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    INSUFFICIENT_STOCK("DOMAIN_PRODUCT_INSUFFICIENT_STOCK", "재고가 부족합니다", 400),
    INVALID_PRODUCT("DOMAIN_PRODUCT_INVALID", "유효하지 않은 상품 정보입니다", 400),

    // Cart Domain
    CART_EMPTY("DOMAIN_CART_EMPTY", "장바구니가 비어 있습니다", 400),
    CART_ITEM_NOT_FOUND("DOMAIN_CART_ITEM_NOT_FOUND", "장바구니 항목을 찾을 수 없습니다", 404),
    CART_INVALID_QUANTITY("DOMAIN_CART_INVALID_QUANTITY", "수량은 1 이상 1000 이하여야 합니다", 400),

    // Order Domain
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),
    INVALID_ORDER_STATUS("DOMAIN_ORDER_INVALID_STATUS",
            "유효하지 않은 주문 상태입니다. pending, processing, shipped, delivered, cancelled 중 하나여야 합니다", 400),
    INVALID_PAYMENT_STATUS("DOMAIN_ORDER_INVALID_PAYMENT_STATUS",
            "유효하지 않은 결제 상태입니다. pending, completed, failed 중 하나여야 합니다", 400),

    // Notification Domain
    NOTIFICATION_NOT_FOUND("DOMAIN_NOTIFICATION_NOT_FOUND", "알림을 찾을 수 없습니다", 404),
    INVALID_NOTIFICATION_TYPE("DOMAIN_NOTIFICATION_INVALID_TYPE",
            "유효하지 않은 알림 유형입니다. order, promotion, system, other 중 하나여야 합니다", 400),

    // ========== Application Layer Errors (5XX) ==========

    ORDER_CREATION_FAILED("APP_ORDER_CREATION_FAILED", "주문 생성에 실패했습니다", 500),

    // ========== System Errors (5XX) ==========

    DATABASE_ERROR("SYSTEM_DATABASE_ERROR", "데이터베이스 오류가 발생했습니다", 500),
    PUSH_DELIVERY_FAILED("SYSTEM_PUSH_DELIVERY_FAILED", "푸시 알림 발송에 실패했습니다", 503),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
