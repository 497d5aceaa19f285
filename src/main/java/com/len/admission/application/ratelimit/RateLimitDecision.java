package com.len.admission.application.ratelimit;

import java.time.Instant;

public record RateLimitDecision(
        boolean allowed,
        int remaining,
        Instant resetTime
) {
    public static RateLimitDecision allow(int remaining, Instant resetTime) {
        return new RateLimitDecision(true, remaining, resetTime);
    }

    public static RateLimitDecision deny(Instant resetTime) {
        return new RateLimitDecision(false, 0, resetTime);
    }
}
