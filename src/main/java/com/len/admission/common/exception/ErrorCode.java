package com.len.admission.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // 공통
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "알 수 없는 오류가 발생했습니다.", false),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "잘못된 요청입니다.", false),

    // 슬롯 / 예약 관련
    SLOT_NOT_FOUND(HttpStatus.NOT_FOUND, "SLOT_NOT_FOUND", "슬롯이 존재하지 않습니다.", false),
    SLOT_IN_PAST(HttpStatus.BAD_REQUEST, "SLOT_IN_PAST", "이미 지난 슬롯입니다.", false),
    ALREADY_BOOKED(HttpStatus.CONFLICT, "ALREADY_BOOKED", "이미 이 슬롯에 확정된 예약이 있습니다.", false),
    BOOKING_NOT_FOUND(HttpStatus.NOT_FOUND, "BOOKING_NOT_FOUND", "예약이 존재하지 않습니다.", false),
    BOOKING_NOT_RELEASABLE(HttpStatus.CONFLICT, "BOOKING_NOT_RELEASABLE", "확정 상태의 예약만 취소할 수 있습니다.", false),

    // 동시성 관련 (재시도 가능)
    CAPACITY_EXCEEDED(HttpStatus.CONFLICT, "CAPACITY_EXCEEDED", "좌석이 방금 마감되었습니다. 잠시 후 다시 시도해주세요.", true),
    SLOT_BUSY(HttpStatus.SERVICE_UNAVAILABLE, "SLOT_BUSY", "요청이 몰리고 있습니다. 잠시 후 다시 시도해주세요.", true),

    // 대기열 관련
    ALREADY_WAITLISTED(HttpStatus.CONFLICT, "ALREADY_WAITLISTED", "이미 이 슬롯의 대기열에 있습니다.", false),
    NOT_WAITLISTED(HttpStatus.NOT_FOUND, "NOT_WAITLISTED", "이 슬롯의 대기열에 없습니다.", false),

    // OTP
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED", "OTP 요청이 너무 많습니다.", true);

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;
    private final boolean retryable;
}
