package com.len.admission.domain.ratelimit;

import java.time.Instant;

public record RateLimitWindow(int count, Instant resetTime) {

    public static RateLimitWindow open(Instant resetTime) {
        return new RateLimitWindow(1, resetTime);
    }

    /**
     * now > resetTime 이면 윈도우 종료 (resetTime 그 순간까지는 유효)
     */
    public boolean isExpired(Instant now) {
        return now.isAfter(resetTime);
    }

    public RateLimitWindow increment() {
        return new RateLimitWindow(count + 1, resetTime);
    }
}
