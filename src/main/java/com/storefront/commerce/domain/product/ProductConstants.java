package com.storefront.commerce.domain.product;

/**
 * ProductConstants - 상품 도메인 상수
 */
public class ProductConstants {

    /** 재고 최소값 */
    public static final int MIN_STOCK = 0;

    /** 한 번에 차감할 수 있는 최소 수량 */
    public static final int MIN_DECREASE_QUANTITY = 1;

    private ProductConstants() {
        throw new AssertionError("ProductConstants는 인스턴스화할 수 없습니다");
    }
}
