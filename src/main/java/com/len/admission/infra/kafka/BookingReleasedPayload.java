package com.len.admission.infra.kafka;

import java.time.Instant;

public record BookingReleasedPayload(
        String eventId,
        Long bookingId,
        Long slotId,
        Instant occurredAt
) {}
