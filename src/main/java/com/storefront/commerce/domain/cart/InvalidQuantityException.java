package com.storefront.commerce.domain.cart;

import com.storefront.commerce.common.exception.DomainException;
import com.storefront.commerce.common.exception.ErrorCode;

/**
 * 유효하지 않은 수량일 때 발생하는 예외 (400)
 */
public class InvalidQuantityException extends DomainException {

    public InvalidQuantityException(Integer quantity) {
        super(ErrorCode.CART_INVALID_QUANTITY, "입력값: " + quantity);
    }
}
