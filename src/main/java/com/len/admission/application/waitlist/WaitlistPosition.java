package com.len.admission.application.waitlist;

import com.len.admission.domain.waitlist.WaitlistEntry;

import java.time.LocalDateTime;

/**
 * 대기 항목 스냅샷. priority 는 조회 시점의 유효 순번(1부터).
 */
public record WaitlistPosition(
        Long entryId,
        long studentId,
        long slotId,
        int priority,
        LocalDateTime createdAt,
        LocalDateTime expiresAt
) {
    public static WaitlistPosition of(WaitlistEntry entry) {
        return of(entry, entry.getPriority());
    }

    public static WaitlistPosition of(WaitlistEntry entry, int priority) {
        return new WaitlistPosition(
                entry.getId(),
                entry.getStudentId(),
                entry.getSlotId(),
                priority,
                entry.getCreatedAt(),
                entry.getExpiresAt()
        );
    }
}
