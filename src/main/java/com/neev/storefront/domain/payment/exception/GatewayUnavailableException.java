package com.neev.storefront.domain.payment.exception;

import com.neev.storefront.common.exception.BusinessException;
import com.neev.storefront.common.exception.ErrorCode;

/**
 * 결제 게이트웨이 호출 실패 예외
 * 주문 생성 흐름에서는 치명적이지 않음 (주문은 결제 대기 상태로 남는다)
 */
public class GatewayUnavailableException extends BusinessException {
    public GatewayUnavailableException(String message, Throwable cause) {
        super(ErrorCode.PAY001, message, cause);
    }
}
