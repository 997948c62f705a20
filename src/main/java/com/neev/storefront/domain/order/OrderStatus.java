package com.neev.storefront.domain.order;

/**
 * 주문 상태
 *
 * CREATED -> CONFIRMED -> FULFILLED
 * CREATED -> REJECTED
 */
public enum OrderStatus {
    CREATED("결제 대기 중인 주문입니다"),
    CONFIRMED("결제가 확인되어 주문이 확정되었습니다"),
    FULFILLED("주문이 처리 완료되었습니다"),
    REJECTED("결제가 거절되어 주문이 취소되었습니다");

    private final String description;

    OrderStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
