package com.len.admission.domain.booking;

import java.util.EnumSet;
import java.util.Set;

public enum BookingStatus {
    CONFIRMED,  // 좌석 점유 중
    CANCELLED,  // 학생/관리자 취소
    COMPLETED,  // 수업 완료 (좌석 점유로 집계)
    NO_SHOW;    // 불참

    public static final Set<BookingStatus> OCCUPYING = EnumSet.of(CONFIRMED, COMPLETED);

    public boolean occupiesSeat() {
        return OCCUPYING.contains(this);
    }
}
