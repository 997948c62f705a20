package com.neev.storefront.domain.order.exception;

import com.neev.storefront.common.exception.BusinessException;
import com.neev.storefront.common.exception.ErrorCode;

/**
 * 종료 상태를 뒤집는 전이를 시도할 때 발생하는 예외
 */
public class OrderStateConflictException extends BusinessException {
    public OrderStateConflictException(Long orderId, String message) {
        super(ErrorCode.O003, message + " (주문 ID: " + orderId + ")");
    }
}
