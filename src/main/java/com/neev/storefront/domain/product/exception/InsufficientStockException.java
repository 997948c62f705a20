package com.neev.storefront.domain.product.exception;

import com.neev.storefront.common.exception.BusinessException;
import com.neev.storefront.common.exception.ErrorCode;

/**
 * 재고가 부족할 때 발생하는 예외
 */
public class InsufficientStockException extends BusinessException {
    public InsufficientStockException() {
        super(ErrorCode.P002);
    }

    public InsufficientStockException(String message) {
        super(ErrorCode.P002, message);
    }

    public InsufficientStockException(int requested, int available) {
        super(ErrorCode.P002,
              String.format("재고가 부족합니다. 요청 수량: %d, 재고: %d", requested, available));
    }
}
