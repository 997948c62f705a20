package com.neev.storefront.application.order.dto;

import com.neev.storefront.domain.order.OrderStatus;
import com.neev.storefront.domain.order.entity.Order;
import com.neev.storefront.domain.payment.PaymentMethod;
import com.neev.storefront.domain.payment.PaymentStatus;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

/**
 * 주문 생성 결과
 * UPI 결제는 /upi/{orderId}, 카드 결제는 /order/{orderId} 로 이동한다
 */
public record CheckoutResponse(
        @Schema(description = "주문 ID", example = "1")
        Long orderId,
        @Schema(description = "게이트웨이 주문 ID (게이트웨이 실패 시 null)", example = "mock_order_1760000000_1")
        String externalId,
        @Schema(description = "총 금액", example = "49998.00")
        BigDecimal totalAmount,
        @Schema(description = "결제 수단", example = "UPI")
        PaymentMethod paymentMethod,
        @Schema(description = "결제 상태", example = "PENDING")
        PaymentStatus paymentStatus,
        @Schema(description = "주문 상태", example = "CREATED")
        OrderStatus status,
        @Schema(description = "다음 화면 경로", example = "/upi/1")
        String nextPath
) {
    public static CheckoutResponse from(Order order) {
        String nextPath = order.getPaymentMethod() == PaymentMethod.UPI
                ? "/upi/" + order.getId()
                : "/order/" + order.getId();
        return new CheckoutResponse(
                order.getId(),
                order.getExternalId(),
                order.getTotalAmount(),
                order.getPaymentMethod(),
                order.getPaymentStatus(),
                order.getStatus(),
                nextPath
        );
    }
}
