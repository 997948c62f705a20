package com.neev.storefront.application.webhook.service;

/**
 * 웹훅 본문을 해석할 수 없을 때 발생하는 예외
 * 게이트웨이에는 성공으로 응답하고 감사 기록만 남긴다
 */
public class MalformedWebhookException extends RuntimeException {

    private final String eventType;

    public MalformedWebhookException(String message, String eventType) {
        super(message);
        this.eventType = eventType;
    }

    public MalformedWebhookException(String message, Throwable cause) {
        super(message, cause);
        this.eventType = null;
    }

    public String getEventType() {
        return eventType;
    }
}
