package com.neev.storefront.domain.cart;

import com.neev.storefront.domain.cart.exception.InvalidCartQuantityException;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 세션 장바구니
 *
 * 상품 ID -> 수량 매핑과 프리미엄 옵션만 보관한다.
 * 가격/상품명은 보관하지 않으며 조회 시점의 상품 정보로 계산한다 (CartCalculator).
 */
public class Cart implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Map<Long, Integer> quantities = new LinkedHashMap<>();
    private boolean premium;

    /**
     * 수량 추가 (이미 담긴 상품이면 누적)
     *
     * @throws ArithmeticException 누적 수량이 int 범위를 넘는 경우
     */
    public void add(Long productId, int quantity) {
        if (quantity < 1) {
            throw new InvalidCartQuantityException(quantity);
        }
        quantities.merge(productId, quantity, Math::addExact);
    }

    /**
     * 전달된 상품들의 수량을 교체, 0 이하이면 장바구니에서 제거
     */
    public void updateQuantities(Map<Long, Integer> newQuantities) {
        newQuantities.forEach((productId, quantity) -> {
            if (quantity == null || quantity <= 0) {
                quantities.remove(productId);
            } else {
                quantities.put(productId, quantity);
            }
        });
    }

    public void remove(Long productId) {
        quantities.remove(productId);
    }

    public void clear() {
        quantities.clear();
        premium = false;
    }

    public int quantityOf(Long productId) {
        return quantities.getOrDefault(productId, 0);
    }

    public Map<Long, Integer> quantities() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(quantities));
    }

    public boolean isEmpty() {
        return quantities.isEmpty();
    }

    public boolean isPremium() {
        return premium;
    }

    public void setPremium(boolean premium) {
        this.premium = premium;
    }
}
