package com.len.admission.domain.notification;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationPayload(
        Long slotId,
        Long bookingId,     // PROMOTED 일 때만
        Integer position,   // WAITLISTED 일 때만
        LocalDateTime expiresAt,
        String message
) {}
