package com.neev.storefront.application.webhook.service;

import com.neev.storefront.application.order.service.OrderTransitionService;
import com.neev.storefront.application.order.service.OrderTransitionService.TransitionResult;
import com.neev.storefront.application.webhook.dto.WebhookEnvelope;
import com.neev.storefront.domain.order.exception.OrderStateConflictException;
import com.neev.storefront.domain.webhook.WebhookOutcome;
import com.neev.storefront.domain.webhook.entity.WebhookEvent;
import com.neev.storefront.domain.webhook.repository.WebhookEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * 서명 검증을 통과한 웹훅 이벤트를 주문 상태에 반영
 *
 * 주문에 반영되지 않은 이벤트(불일치/미지원/형식 오류/상태 충돌)는 감사 기록으로 남기고
 * 정상 처리로 응답한다. 게이트웨이가 재전송하지 않도록 하기 위함이다.
 * 상태 전이는 OrderTransitionService 의 트랜잭션에서 수행되므로 여기서는 트랜잭션을 열지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookEventProcessor {

    private final WebhookEventParser webhookEventParser;
    private final OrderTransitionService orderTransitionService;
    private final WebhookEventRepository webhookEventRepository;

    /**
     * @return 주문 상태가 반영되었으면 true, 감사 기록만 남겼으면 false
     */
    public boolean process(byte[] rawBody) {
        String raw = new String(rawBody == null ? new byte[0] : rawBody, StandardCharsets.UTF_8);

        // 1. 본문 해석
        WebhookEnvelope envelope;
        try {
            envelope = webhookEventParser.parse(rawBody);
        } catch (MalformedWebhookException e) {
            audit(WebhookOutcome.MALFORMED, e.getEventType(), null, raw, e.getMessage());
            return false;
        }

        // 2. 결제 완료 이벤트만 처리
        if (!envelope.isPaymentCaptured()) {
            audit(WebhookOutcome.UNKNOWN_EVENT, envelope.eventType(), envelope.externalId(), raw, "처리하지 않는 이벤트");
            return false;
        }
        if (envelope.externalId() == null) {
            audit(WebhookOutcome.MALFORMED, envelope.eventType(), null, raw, "payment entity 에 주문 ID 없음");
            return false;
        }

        // 3. 주문 결제 완료 처리
        Optional<TransitionResult> result;
        try {
            result = orderTransitionService.markPaidByExternalId(envelope.externalId(), envelope.entityJson());
        } catch (OrderStateConflictException e) {
            audit(WebhookOutcome.CONFLICT, envelope.eventType(), envelope.externalId(), raw, e.getMessage());
            return false;
        }

        if (result.isEmpty()) {
            audit(WebhookOutcome.UNMATCHED, envelope.eventType(), envelope.externalId(), raw, "일치하는 주문 없음");
            return false;
        }
        return true;
    }

    private void audit(WebhookOutcome outcome, String eventType, String externalId, String raw, String note) {
        webhookEventRepository.save(WebhookEvent.of(outcome, eventType, externalId, raw, note));
        log.warn("웹훅 감사 기록 - outcome={}, event={}, externalId={}, note={}", outcome, eventType, externalId, note);
    }
}
