package com.neev.storefront.application.order.dto;

import com.neev.storefront.application.order.service.OrderTransitionService.TransitionResult;
import com.neev.storefront.domain.order.OrderStatus;
import com.neev.storefront.domain.payment.PaymentStatus;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 관리자 상태 전이 결과
 */
public record OrderStatusResponse(
        @Schema(description = "주문 ID", example = "1")
        Long orderId,
        @Schema(description = "결제 상태", example = "PAID")
        PaymentStatus paymentStatus,
        @Schema(description = "주문 상태", example = "CONFIRMED")
        OrderStatus status,
        @Schema(description = "이번 요청으로 상태가 바뀌었는지 여부 (이미 같은 상태면 false)", example = "true")
        boolean changed
) {
    public static OrderStatusResponse from(TransitionResult result) {
        return new OrderStatusResponse(
                result.order().getId(),
                result.order().getPaymentStatus(),
                result.order().getStatus(),
                result.changed()
        );
    }
}
