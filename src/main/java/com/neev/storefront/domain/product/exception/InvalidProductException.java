package com.neev.storefront.domain.product.exception;

import com.neev.storefront.common.exception.BusinessException;
import com.neev.storefront.common.exception.ErrorCode;

/**
 * 상품 등록/수정 값이 올바르지 않을 때 발생하는 예외
 */
public class InvalidProductException extends BusinessException {
    public InvalidProductException(String message) {
        super(ErrorCode.P003, message);
    }
}
