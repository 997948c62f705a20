package com.neev.storefront.application.webhook.usecase;

import com.neev.storefront.application.webhook.service.WebhookEventProcessor;
import com.neev.storefront.common.config.StoreProperties;
import com.neev.storefront.domain.payment.exception.InvalidSignatureException;
import com.neev.storefront.domain.payment.gateway.SignatureVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 웹훅 수신 UseCase
 *
 * 1. 서명 검증 (실패 시 InvalidSignatureException, 주문 상태 변경 없음)
 *    - 웹훅 시크릿이 있으면 항상 HMAC 검증
 *    - 시크릿이 없으면 allow-unsigned-webhooks=true 이고 test=1 요청일 때만 통과
 * 2. 이벤트 처리 (WebhookEventProcessor)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HandleWebhookUseCase {

    private final SignatureVerifier signatureVerifier;
    private final WebhookEventProcessor webhookEventProcessor;
    private final StoreProperties storeProperties;

    public boolean execute(byte[] rawBody, String signature, boolean testRequest) {
        if (!isVerified(rawBody, signature, testRequest)) {
            log.warn("웹훅 서명 검증 실패 - signaturePresent={}", signature != null && !signature.isBlank());
            throw new InvalidSignatureException();
        }
        return webhookEventProcessor.process(rawBody);
    }

    private boolean isVerified(byte[] rawBody, String signature, boolean testRequest) {
        StoreProperties.Gateway gateway = storeProperties.getGateway();
        if (gateway.hasWebhookSecret()) {
            return signatureVerifier.verify(rawBody, signature, gateway.getWebhookSecret());
        }
        return testRequest && gateway.isAllowUnsignedWebhooks();
    }
}
