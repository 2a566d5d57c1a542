package com.storefront.commerce.domain.cart;

import com.storefront.commerce.common.exception.DomainException;
import com.storefront.commerce.common.exception.ErrorCode;

/**
 * 장바구니가 없거나 항목이 0개인 상태에서 주문을 시도할 때 발생하는 예외 (400)
 */
public class EmptyCartException extends DomainException {

    public EmptyCartException(Long userId) {
        super(ErrorCode.CART_EMPTY, "userId=" + userId);
    }
}
