package com.neev.storefront.domain.payment.exception;

import com.neev.storefront.common.exception.BusinessException;
import com.neev.storefront.common.exception.ErrorCode;

/**
 * 웹훅 서명 검증 실패 예외
 */
public class InvalidSignatureException extends BusinessException {
    public InvalidSignatureException() {
        super(ErrorCode.PAY002);
    }
}
