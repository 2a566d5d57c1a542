package com.storefront.commerce.domain.product;

import com.storefront.commerce.common.exception.DomainException;
import com.storefront.commerce.common.exception.ErrorCode;

/**
 * 상품 가격/재고 규칙을 위반했을 때 발생하는 예외 (400)
 */
public class InvalidProductException extends DomainException {

    public InvalidProductException(String detailMessage) {
        super(ErrorCode.INVALID_PRODUCT, detailMessage);
    }
}
