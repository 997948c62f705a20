package com.neev.storefront.domain.payment;

/**
 * 결제 상태
 */
public enum PaymentStatus {
    PENDING("결제 대기"),
    PAID("결제 완료"),
    REJECTED("결제 거절");

    private final String description;

    PaymentStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
