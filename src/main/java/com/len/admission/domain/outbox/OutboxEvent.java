package com.len.admission.domain.outbox;

import com.len.admission.domain.notification.NotificationKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 알림 요청 outbox. OutboxPublisher 가 Kafka 로 내보낸다.
 */
@Entity
@Table(
        name = "outbox_event",
        indexes = @Index(name = "ix_outbox_status_next_retry", columnList = "status, next_retry_at")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEvent {

    private static final int DEFAULT_MAX_RETRY = 10;
    private static final int MAX_BACKOFF_SECONDS = 60;
    private static final int ERROR_LIMIT = 500;

    @Id
    @Column(name = "event_id", length = 64, nullable = false, updatable = false)
    private String eventId;

    @Column(name = "topic", length = 120, nullable = false)
    private String topic;

    // 파티션 키 = studentId (학생별 알림 순서 유지)
    @Column(name = "event_key", length = 120, nullable = false)
    private String eventKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", length = 20, nullable = false)
    private NotificationKind kind;

    @Lob
    @Column(name = "payload", columnDefinition = "json", nullable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private OutboxStatus status;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "max_retry", nullable = false)
    private int maxRetry;

    @Column(name = "next_retry_at", nullable = false)
    private LocalDateTime nextRetryAt;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "last_error", length = ERROR_LIMIT)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static OutboxEvent pending(String eventId, String topic, String eventKey,
                                      NotificationKind kind, String payload, LocalDateTime now) {
        OutboxEvent e = new OutboxEvent();
        e.eventId = eventId;
        e.topic = topic;
        e.eventKey = eventKey;
        e.kind = kind;
        e.payload = payload;
        e.status = OutboxStatus.PENDING;
        e.retryCount = 0;
        e.maxRetry = DEFAULT_MAX_RETRY;
        e.nextRetryAt = now;
        e.createdAt = now;
        e.updatedAt = now;
        return e;
    }

    public void markPublished(LocalDateTime now) {
        this.status = OutboxStatus.PUBLISHED;
        this.publishedAt = now;
        this.lastError = null;
        this.updatedAt = now;
    }

    /**
     * retry_count 증가 후 한도 이상이면 FAILED, 아니면 PENDING + 지수 backoff (2,4,8,...,60초)
     */
    public void markRetryOrFail(String errorMessage, LocalDateTime now) {
        this.retryCount += 1;
        this.lastError = truncate(errorMessage);
        this.updatedAt = now;

        if (this.retryCount >= this.maxRetry) {
            this.status = OutboxStatus.FAILED;
            return;
        }

        this.status = OutboxStatus.PENDING;
        this.nextRetryAt = now.plusSeconds(backoffSeconds(retryCount));
    }

    public boolean isFailed() {
        return status == OutboxStatus.FAILED;
    }

    static int backoffSeconds(int retryCount) {
        return Math.min(MAX_BACKOFF_SECONDS, 1 << Math.min(6, retryCount));
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() <= ERROR_LIMIT ? s : s.substring(0, ERROR_LIMIT);
    }
}
