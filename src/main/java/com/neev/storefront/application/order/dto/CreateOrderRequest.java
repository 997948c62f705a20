package com.neev.storefront.application.order.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 결제(주문 생성) 폼
 */
public record CreateOrderRequest(
        @Schema(description = "주문자 이름", example = "Asha Rao")
        String name,

        @Schema(description = "이메일 (선택)", example = "asha@example.com")
        String email,

        @Schema(description = "연락처", example = "9876543210")
        String phone,

        @Schema(description = "배송 주소", example = "12 MG Road, Bengaluru")
        String address,

        @Schema(description = "결제 수단 (upi/card, 기본 upi)", example = "upi")
        String paymentMethod
) {}
