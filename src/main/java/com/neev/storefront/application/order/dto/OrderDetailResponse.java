package com.neev.storefront.application.order.dto;

import com.neev.storefront.domain.order.OrderStatus;
import com.neev.storefront.domain.order.entity.Order;
import com.neev.storefront.domain.order.entity.OrderItem;
import com.neev.storefront.domain.payment.PaymentMethod;
import com.neev.storefront.domain.payment.PaymentStatus;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 상태 조회 응답
 */
public record OrderDetailResponse(
        @Schema(description = "주문 ID", example = "1")
        Long orderId,
        @Schema(description = "게이트웨이 주문 ID", example = "mock_order_1760000000_1")
        String externalId,
        @Schema(description = "주문자 이름", example = "Asha Rao")
        String customerName,
        @Schema(description = "이메일", example = "asha@example.com")
        String customerEmail,
        @Schema(description = "연락처", example = "9876543210")
        String customerPhone,
        @Schema(description = "배송 주소", example = "12 MG Road, Bengaluru")
        String address,
        @Schema(description = "프리미엄 옵션", example = "false")
        boolean premium,
        @Schema(description = "총 금액", example = "49998.00")
        BigDecimal totalAmount,
        @Schema(description = "결제 수단", example = "UPI")
        PaymentMethod paymentMethod,
        @Schema(description = "결제 상태", example = "PENDING")
        PaymentStatus paymentStatus,
        @Schema(description = "주문 상태", example = "CREATED")
        OrderStatus status,
        @Schema(description = "상태 안내 문구", example = "결제 대기 중인 주문입니다")
        String statusMessage,
        @Schema(description = "주문 항목")
        List<OrderItemResponse> items,
        @Schema(description = "주문 일시", example = "2026-10-17T10:00:00")
        LocalDateTime createdAt
) {
    public static OrderDetailResponse from(Order order, List<OrderItem> items) {
        return new OrderDetailResponse(
                order.getId(),
                order.getExternalId(),
                order.getCustomer().name(),
                order.getCustomer().email(),
                order.getCustomer().phone(),
                order.getCustomer().address(),
                order.isPremium(),
                order.getTotalAmount(),
                order.getPaymentMethod(),
                order.getPaymentStatus(),
                order.getStatus(),
                order.getStatus().getDescription(),
                items.stream().map(OrderItemResponse::from).toList(),
                order.getCreatedAt()
        );
    }
}
