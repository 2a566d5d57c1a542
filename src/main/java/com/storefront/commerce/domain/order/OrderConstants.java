package com.storefront.commerce.domain.order;

/**
 * OrderConstants - 주문 도메인 상수
 */
public class OrderConstants {

    /** 주문 항목 최소 수량 */
    public static final int MIN_ORDER_QUANTITY = 1;

    /** 주문 메모 기본 최대 길이 (commerce.order.note-max-length 미설정 시) */
    public static final int DEFAULT_NOTE_MAX_LENGTH = 100;

    /** 주문 메모 컬럼 길이 (설정 가능한 최대 길이의 상한) */
    public static final int NOTE_COLUMN_LENGTH = 1000;

    /** 배송지 street/city/state/country 컬럼 길이 */
    public static final int ADDRESS_FIELD_MAX_LENGTH = 255;

    /** 우편번호 컬럼 길이 */
    public static final int ZIP_CODE_MAX_LENGTH = 20;

    /** 결제 수단 컬럼 길이 */
    public static final int PAYMENT_METHOD_MAX_LENGTH = 255;

    /** 멱등성 키 최대 길이 */
    public static final int MAX_CHECKOUT_KEY_LENGTH = 64;

    /** 주문 목록 기본 페이지 크기 */
    public static final int DEFAULT_PAGE_SIZE = 10;

    private OrderConstants() {
        throw new AssertionError("OrderConstants는 인스턴스화할 수 없습니다");
    }
}
