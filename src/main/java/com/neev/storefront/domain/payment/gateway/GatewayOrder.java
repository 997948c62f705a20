package com.neev.storefront.domain.payment.gateway;

import java.util.Map;

/**
 * 게이트웨이가 반환한 원격 결제 주문
 *
 * @param remoteId 게이트웨이 주문 ID (웹훅 이벤트와 로컬 주문을 매칭하는 키)
 * @param amountMinorUnits 최소 화폐 단위 금액 (paise)
 * @param rawPayload 감사/디버깅용 원본 응답
 */
public record GatewayOrder(
        String remoteId,
        long amountMinorUnits,
        String currency,
        String status,
        Map<String, Object> rawPayload
) {
}
