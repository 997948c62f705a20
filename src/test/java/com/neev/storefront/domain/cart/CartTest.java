package com.neev.storefront.domain.cart;

import com.neev.storefront.domain.cart.exception.InvalidCartQuantityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("세션 장바구니 테스트")
class CartTest {

    @Test
    @DisplayName("같은 상품을 다시 담으면 수량이 누적된다")
    void 수량_누적() {
        // given
        Cart cart = new Cart();

        // when
        cart.add(1L, 2);
        cart.add(1L, 1);

        // then
        assertThat(cart.quantityOf(1L)).isEqualTo(3);
    }

    @Test
    @DisplayName("1 미만의 수량은 담을 수 없다")
    void 수량_검증() {
        // given
        Cart cart = new Cart();

        // when & then
        assertThatThrownBy(() -> cart.add(1L, 0))
                .isInstanceOf(InvalidCartQuantityException.class);
        assertThat(cart.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("수량을 0 이하로 수정하면 장바구니에서 제거된다")
    void 수량_수정_제거() {
        // given
        Cart cart = new Cart();
        cart.add(1L, 2);
        cart.add(2L, 1);

        Map<Long, Integer> update = new HashMap<>();
        update.put(1L, 0);
        update.put(2L, 4);
        update.put(3L, -1);

        // when
        cart.updateQuantities(update);

        // then
        assertThat(cart.quantities()).containsExactly(Map.entry(2L, 4));
    }

    @Test
    @DisplayName("비우면 프리미엄 옵션도 해제된다")
    void 장바구니_비우기() {
        // given
        Cart cart = new Cart();
        cart.add(1L, 1);
        cart.setPremium(true);

        // when
        cart.clear();

        // then
        assertThat(cart.isEmpty()).isTrue();
        assertThat(cart.isPremium()).isFalse();
    }

    @Test
    @DisplayName("quantities 는 수정할 수 없는 복사본을 반환한다")
    void 수량_복사본() {
        // given
        Cart cart = new Cart();
        cart.add(1L, 1);

        // when
        Map<Long, Integer> snapshot = cart.quantities();
        cart.remove(1L);

        // then
        assertThat(snapshot).containsEntry(1L, 1);
        assertThatThrownBy(() -> snapshot.put(2L, 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("누적 수량이 int 범위를 넘으면 예외가 발생하고 기존 수량은 유지된다")
    void 수량_누적_오버플로() {
        // given
        Cart cart = new Cart();
        cart.add(1L, 1);

        // when & then
        assertThatThrownBy(() -> cart.add(1L, Integer.MAX_VALUE))
                .isInstanceOf(ArithmeticException.class);
        assertThat(cart.quantityOf(1L)).isEqualTo(1);
    }
}
