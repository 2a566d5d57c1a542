package com.storefront.commerce.domain.cart;

import com.storefront.commerce.common.exception.DomainException;
import com.storefront.commerce.common.exception.ErrorCode;

/**
 * 장바구니 아이템을 찾을 수 없을 때 발생하는 예외 (404)
 * 다른 사용자의 장바구니 항목을 지정한 경우도 포함한다.
 */
public class CartItemNotFoundException extends DomainException {

    public CartItemNotFoundException(Long cartItemId) {
        super(ErrorCode.CART_ITEM_NOT_FOUND, "cartItemId=" + cartItemId);
    }
}
