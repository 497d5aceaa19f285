package com.len.admission.infra.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.len.admission.domain.notification.NotificationDispatcher;
import com.len.admission.domain.notification.NotificationKind;
import com.len.admission.domain.notification.NotificationPayload;
import com.len.admission.domain.outbox.OutboxEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 알림 요청을 outbox 테이블에 적재. 실제 Kafka 발행은 OutboxPublisher.
 */
@Component
@RequiredArgsConstructor
public class OutboxNotificationDispatcher implements NotificationDispatcher {

    public static final String TOPIC = "admission.notification.requested.v1";

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // 예약 트랜잭션과 분리 (알림 적재 실패가 예약을 롤백하지 않게)
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void notify(long studentId, NotificationKind kind, NotificationPayload payload) {
        String eventId = UUID.randomUUID().toString();
        NotificationRequestedMessage message = new NotificationRequestedMessage(
                eventId, studentId, kind, payload, clock.instant()
        );

        String json;
        try {
            json = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Outbox payload serialize failed. kind=" + kind, e);
        }

        outboxEventRepository.save(OutboxEvent.pending(
                eventId, TOPIC, String.valueOf(studentId), kind, json, LocalDateTime.now(clock)
        ));
    }
}
