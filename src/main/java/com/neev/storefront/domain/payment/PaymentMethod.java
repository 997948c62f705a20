package com.neev.storefront.domain.payment;

import com.neev.storefront.domain.order.exception.InvalidOrderException;

import java.util.Locale;

/**
 * 결제 수단
 */
public enum PaymentMethod {
    CARD("카드"),
    UPI("UPI");

    private final String description;

    PaymentMethod(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 폼 값(card/upi)을 결제 수단으로 변환, 값이 없으면 UPI
     */
    public static PaymentMethod from(String value) {
        if (value == null || value.isBlank()) {
            return UPI;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidOrderException("지원하지 않는 결제 수단입니다: " + value);
        }
    }
}
