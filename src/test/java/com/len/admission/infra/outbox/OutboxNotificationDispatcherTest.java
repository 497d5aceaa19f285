package com.len.admission.infra.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.len.admission.domain.notification.NotificationKind;
import com.len.admission.domain.notification.NotificationPayload;
import com.len.admission.domain.outbox.OutboxEvent;
import com.len.admission.domain.outbox.OutboxStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class OutboxNotificationDispatcherTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 9, 0);

    @Mock
    OutboxEventRepository outboxEventRepository;

    ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    @DisplayName("notify: 학생 id 를 키로 PENDING outbox 이벤트 적재")
    void notify_savesPendingEvent() throws Exception {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        OutboxNotificationDispatcher dispatcher =
                new OutboxNotificationDispatcher(outboxEventRepository, objectMapper, clock);

        dispatcher.notify(10L, NotificationKind.WAITLISTED,
                new NotificationPayload(3L, null, 2, NOW.plusHours(24), "대기열에 등록되었습니다. 현재 순번: 2"));

        ArgumentCaptor<OutboxEvent> captor = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxEventRepository).save(captor.capture());
        OutboxEvent saved = captor.getValue();

        assertThat(saved.getTopic()).isEqualTo(OutboxNotificationDispatcher.TOPIC);
        assertThat(saved.getEventKey()).isEqualTo("10");
        assertThat(saved.getKind()).isEqualTo(NotificationKind.WAITLISTED);
        assertThat(saved.getStatus()).isEqualTo(OutboxStatus.PENDING);
        assertThat(saved.getNextRetryAt()).isEqualTo(NOW);

        JsonNode json = objectMapper.readTree(saved.getPayload());
        assertThat(json.get("eventId").asText()).isEqualTo(saved.getEventId());
        assertThat(json.get("studentId").asLong()).isEqualTo(10L);
        assertThat(json.get("kind").asText()).isEqualTo("WAITLISTED");
        assertThat(json.get("payload").get("position").asInt()).isEqualTo(2);
        // null 필드는 빠진다
        assertThat(json.get("payload").has("bookingId")).isFalse();
    }
}
