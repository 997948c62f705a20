package com.neev.storefront.domain.cart.exception;

import com.neev.storefront.common.exception.BusinessException;
import com.neev.storefront.common.exception.ErrorCode;

/**
 * 유효하지 않은 장바구니 수량일 때 발생하는 예외
 */
public class InvalidCartQuantityException extends BusinessException {
    public InvalidCartQuantityException(int quantity) {
        super(ErrorCode.CART001, "수량은 1개 이상이어야 합니다: " + quantity);
    }
}
