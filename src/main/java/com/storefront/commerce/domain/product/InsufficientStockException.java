package com.storefront.commerce.domain.product;

import com.storefront.commerce.common.exception.DomainException;
import com.storefront.commerce.common.exception.ErrorCode;

/**
 * 재고 부족 예외 (400)
 *
 * 메시지에 부족한 상품명을 포함한다.
 * 예: "재고가 부족합니다 | 상품: 무선 키보드 (요청: 3, 재고: 1)"
 */
public class InsufficientStockException extends DomainException {

    private final String productName;

    public InsufficientStockException(String productName, int requested, int available) {
        super(ErrorCode.INSUFFICIENT_STOCK,
                String.format("상품: %s (요청: %d, 재고: %d)", productName, requested, available));
        this.productName = productName;
    }

    public InsufficientStockException(String productName, int requested) {
        super(ErrorCode.INSUFFICIENT_STOCK,
                String.format("상품: %s (요청: %d)", productName, requested));
        this.productName = productName;
    }

    public String getProductName() {
        return productName;
    }
}
