package com.neev.storefront.domain.order.exception;

import com.neev.storefront.common.exception.BusinessException;
import com.neev.storefront.common.exception.ErrorCode;

/**
 * 주문 요청 값이 올바르지 않을 때 발생하는 예외
 */
public class InvalidOrderException extends BusinessException {
    public InvalidOrderException(String message) {
        super(ErrorCode.O001, message);
    }
}
