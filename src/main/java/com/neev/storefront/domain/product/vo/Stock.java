package com.neev.storefront.domain.product.vo;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * 재고 Value Object
 * 재고 수량과 관련된 비즈니스 로직을 캡슐화
 */
@Embeddable
public record Stock(
        @Column(name = "stock", nullable = false)
        int quantity
) {

    /**
     * Compact constructor - 유효성 검증
     */
    public Stock {
        if (quantity < 0) {
            throw new IllegalArgumentException("재고는 음수일 수 없습니다");
        }
    }

    /**
     * 요청한 수량만큼 재고가 있는지 확인
     */
    public boolean isAvailable(int requestedAmount) {
        return this.quantity >= requestedAmount;
    }
}
