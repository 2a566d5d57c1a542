package com.storefront.commerce.domain.user;

import com.storefront.commerce.common.exception.DomainException;
import com.storefront.commerce.common.exception.ErrorCode;

/**
 * 사용자를 찾을 수 없을 때 발생하는 예외 (404)
 */
public class UserNotFoundException extends DomainException {

    public UserNotFoundException(Long userId) {
        super(ErrorCode.USER_NOT_FOUND, "userId=" + userId);
    }
}
