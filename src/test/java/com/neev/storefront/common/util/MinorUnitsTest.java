package com.neev.storefront.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("최소 화폐 단위 변환 테스트")
class MinorUnitsTest {

    @Test
    @DisplayName("금액에 100 을 곱한 정수로 변환한다")
    void 기본_변환() {
        assertThat(MinorUnits.toMinorUnits(new BigDecimal("49998.00"))).isEqualTo(4999800L);
        assertThat(MinorUnits.toMinorUnits(new BigDecimal("999"))).isEqualTo(99900L);
    }

    @Test
    @DisplayName("소수 셋째 자리는 HALF_UP 으로 반올림한다")
    void 반올림() {
        assertThat(MinorUnits.toMinorUnits(new BigDecimal("10.005"))).isEqualTo(1001L);
        assertThat(MinorUnits.toMinorUnits(new BigDecimal("10.004"))).isEqualTo(1000L);
        assertThat(MinorUnits.toMinorUnits(new BigDecimal("10.015"))).isEqualTo(1002L);
    }

    @Test
    @DisplayName("최소 단위를 금액으로 되돌린다")
    void 역변환() {
        assertThat(MinorUnits.fromMinorUnits(4999800L)).isEqualByComparingTo("49998.00");
    }

    @Test
    @DisplayName("null 금액은 허용하지 않는다")
    void null_금액() {
        assertThatThrownBy(() -> MinorUnits.toMinorUnits(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
