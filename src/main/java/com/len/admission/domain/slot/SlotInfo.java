package com.len.admission.domain.slot;

import java.time.LocalDateTime;

public record SlotInfo(
        long id,
        int capacity,
        LocalDateTime startAt,
        LocalDateTime endAt
) {
    /**
     * 시작 시각이 지났으면 대기/예약 불가
     */
    public boolean hasStarted(LocalDateTime now) {
        return startAt.isBefore(now);
    }
}
