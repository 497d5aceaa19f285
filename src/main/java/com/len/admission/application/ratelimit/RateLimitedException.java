package com.len.admission.application.ratelimit;

import com.len.admission.common.exception.BusinessException;
import com.len.admission.common.exception.ErrorCode;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

@Getter
public class RateLimitedException extends BusinessException {

    private final Instant resetTime;
    private final long retryAfterSeconds;

    public RateLimitedException(Instant resetTime, Instant now) {
        super(ErrorCode.RATE_LIMITED, message(resetTime, now));
        this.resetTime = resetTime;
        this.retryAfterSeconds = Math.max(0, Duration.between(now, resetTime).toSeconds());
    }

    // 분 단위 올림 ("N분 후")
    static long minutesUntil(Instant resetTime, Instant now) {
        long millis = Math.max(0, Duration.between(now, resetTime).toMillis());
        return (millis + 59_999) / 60_000;
    }

    private static String message(Instant resetTime, Instant now) {
        return ErrorCode.RATE_LIMITED.getMessage() + " " + minutesUntil(resetTime, now) + "분 후에 다시 시도해주세요.";
    }
}
