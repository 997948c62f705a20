package com.neev.storefront.application.webhook.dto;

import java.util.Set;

/**
 * 해석된 웹훅 이벤트
 *
 * @param eventType event 필드, 없으면 type 필드
 * @param externalId payload.payment.entity 의 order_id, 없으면 id
 * @param entityJson payload.payment.entity 원문 (주문 감사 payload 로 저장)
 */
public record WebhookEnvelope(
        String eventType,
        String externalId,
        String entityJson
) {
    private static final Set<String> PAYMENT_CAPTURED = Set.of("payment.captured", "payment.captured.v1");

    public boolean isPaymentCaptured() {
        return eventType != null && PAYMENT_CAPTURED.contains(eventType);
    }
}
