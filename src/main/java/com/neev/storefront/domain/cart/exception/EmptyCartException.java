package com.neev.storefront.domain.cart.exception;

import com.neev.storefront.common.exception.BusinessException;
import com.neev.storefront.common.exception.ErrorCode;

/**
 * 장바구니가 비어있을 때 발생하는 예외
 */
public class EmptyCartException extends BusinessException {
    public EmptyCartException() {
        super(ErrorCode.CART002);
    }
}
