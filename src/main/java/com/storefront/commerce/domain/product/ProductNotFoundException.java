package com.storefront.commerce.domain.product;

import com.storefront.commerce.common.exception.DomainException;
import com.storefront.commerce.common.exception.ErrorCode;

/**
 * ProductNotFoundException - 상품을 찾을 수 없을 때 발생하는 예외 (404)
 *
 * 발생 위치:
 * - 상품 상세 조회
 * - 장바구니 담기
 * - 주문 시 장바구니 항목의 상품 재조회 (그 사이 상품이 삭제된 경우)
 */
public class ProductNotFoundException extends DomainException {

    private final Long productId;

    public ProductNotFoundException(Long productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "productId=" + productId);
        this.productId = productId;
    }

    public Long getProductId() {
        return productId;
    }
}
