package com.len.admission.domain.notification;

public enum NotificationKind {
    WAITLISTED, // 대기열 등록 (순번 포함)
    PROMOTED,   // 대기 → 확정 예약 전환
    EXPIRED     // 대기 항목 만료
}
