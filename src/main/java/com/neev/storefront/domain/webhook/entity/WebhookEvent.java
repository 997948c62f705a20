package com.neev.storefront.domain.webhook.entity;

import com.neev.storefront.domain.webhook.WebhookOutcome;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 웹훅 감사 기록 엔티티
 * 주문에 반영되지 않은 수신 이벤트를 원본 그대로 보관
 */
@Entity
@Table(name = "webhook_events", indexes = {
        @Index(name = "idx_webhook_events_external_id", columnList = "external_id"),
        @Index(name = "idx_webhook_events_outcome", columnList = "outcome, received_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WebhookEvent {

    static final int KEY_LENGTH = 255;
    static final int NOTE_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "event_type", length = KEY_LENGTH)
    private String eventType;      // payment.captured 등, 파싱 실패 시 null

    @Column(name = "external_id", length = KEY_LENGTH)
    private String externalId;     // 게이트웨이 주문 ID

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false)
    private WebhookOutcome outcome;

    @Column(name = "payload", columnDefinition = "TEXT")
    private String payload;        // 수신 원문

    @Column(name = "note", length = NOTE_LENGTH)
    private String note;

    @Column(name = "received_at", nullable = false)
    private LocalDateTime receivedAt;

    @PrePersist
    protected void onCreate() {
        if (this.receivedAt == null) {
            this.receivedAt = LocalDateTime.now();
        }
    }

    /**
     * 감사 기록 생성
     * 컬럼 길이를 넘는 값은 잘라서 저장한다 (원문은 payload 에 그대로 남는다)
     */
    public static WebhookEvent of(WebhookOutcome outcome, String eventType, String externalId,
                                  String payload, String note) {
        return WebhookEvent.builder()
                .outcome(outcome)
                .eventType(truncate(eventType, KEY_LENGTH))
                .externalId(truncate(externalId, KEY_LENGTH))
                .payload(payload)
                .note(truncate(note, NOTE_LENGTH))
                .build();
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
