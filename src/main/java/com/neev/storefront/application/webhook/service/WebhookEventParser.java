package com.neev.storefront.application.webhook.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neev.storefront.application.webhook.dto.WebhookEnvelope;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 웹훅 본문 해석기
 *
 * {"event": "...", "payload": {"payment": {"entity": {"order_id": "...", "id": "..."}}}}
 * 결제 완료 이벤트가 아니면 entity 를 요구하지 않는다
 */
@Component
@RequiredArgsConstructor
public class WebhookEventParser {

    private final ObjectMapper objectMapper;

    public WebhookEnvelope parse(byte[] rawBody) {
        JsonNode root = readTree(rawBody);
        if (!root.isObject()) {
            throw new MalformedWebhookException("JSON 객체가 아닙니다", (String) null);
        }

        String eventType = text(root, "event");
        if (eventType == null) {
            eventType = text(root, "type");
        }

        JsonNode entity = root.path("payload").path("payment").path("entity");
        if (!entity.isObject()) {
            return new WebhookEnvelope(eventType, null, null);
        }

        String externalId = text(entity, "order_id");
        if (externalId == null) {
            externalId = text(entity, "id");
        }
        return new WebhookEnvelope(eventType, externalId, entity.toString());
    }

    private JsonNode readTree(byte[] rawBody) {
        if (rawBody == null || rawBody.length == 0) {
            throw new MalformedWebhookException("본문이 비어 있습니다", (String) null);
        }
        try {
            return objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new MalformedWebhookException("JSON 파싱 실패: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedWebhookException("본문 읽기 실패", e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
