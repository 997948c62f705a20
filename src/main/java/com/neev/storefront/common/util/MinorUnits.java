package com.neev.storefront.common.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 금액 <-> 최소 화폐 단위(paise) 변환
 *
 * 게이트웨이 정산 대사에 쓰이므로 반올림 규칙은 HALF_UP 으로 고정한다.
 * 예) 24999.005 -> 2499901, 24999.004 -> 2499900
 */
public final class MinorUnits {

    private static final int MINOR_UNIT_SCALE = 2;

    private MinorUnits() {
    }

    public static long toMinorUnits(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("금액은 필수입니다");
        }
        return amount.movePointRight(MINOR_UNIT_SCALE)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    public static BigDecimal fromMinorUnits(long minorUnits) {
        return BigDecimal.valueOf(minorUnits, MINOR_UNIT_SCALE);
    }
}
