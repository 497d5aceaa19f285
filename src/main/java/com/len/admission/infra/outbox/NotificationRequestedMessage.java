package com.len.admission.infra.outbox;

import com.len.admission.domain.notification.NotificationKind;
import com.len.admission.domain.notification.NotificationPayload;

import java.time.Instant;

/**
 * admission.notification.requested.v1 메시지 본문. SMS 워커가 소비한다.
 */
public record NotificationRequestedMessage(
        String eventId,
        long studentId,
        NotificationKind kind,
        NotificationPayload payload,
        Instant requestedAt
) {}
