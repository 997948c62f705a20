package com.neev.storefront.domain.webhook;

/**
 * 주문 상태를 바꾸지 않은 웹훅 이벤트의 처리 결과
 */
public enum WebhookOutcome {
    UNMATCHED,      // 결제 완료 이벤트지만 일치하는 주문 없음
    UNKNOWN_EVENT,  // 처리하지 않는 이벤트 종류
    MALFORMED,      // JSON 파싱 실패 또는 필수 필드 누락
    CONFLICT        // 종료 상태 주문에 대한 결제 완료 (예: 거절된 주문)
}
