package com.len.admission.api.admission.dto;

import com.len.admission.application.waitlist.WaitlistPosition;

import java.time.LocalDateTime;

public record WaitlistEntryResponse(
        Long entryId,
        long studentId,
        long slotId,
        int priority,
        LocalDateTime createdAt,
        LocalDateTime expiresAt
) {
    public static WaitlistEntryResponse from(WaitlistPosition position) {
        return new WaitlistEntryResponse(
                position.entryId(),
                position.studentId(),
                position.slotId(),
                position.priority(),
                position.createdAt(),
                position.expiresAt()
        );
    }
}
