package com.len.admission.application.ratelimit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitedExceptionTest {

    private static final Instant NOW = Instant.parse("2026-03-02T00:00:00Z");

    @Test
    @DisplayName("남은 시간은 분 단위 올림")
    void minutesUntil_roundsUp() {
        assertThat(RateLimitedException.minutesUntil(NOW.plusSeconds(60), NOW)).isEqualTo(1);
        assertThat(RateLimitedException.minutesUntil(NOW.plusSeconds(61), NOW)).isEqualTo(2);
        assertThat(RateLimitedException.minutesUntil(NOW.plusMillis(1), NOW)).isEqualTo(1);
        assertThat(RateLimitedException.minutesUntil(NOW.minusSeconds(5), NOW)).isZero();
    }

    @Test
    @DisplayName("retryable + Retry-After 초")
    void carriesResetTime() {
        RateLimitedException e = new RateLimitedException(NOW.plusSeconds(600), NOW);

        assertThat(e.isRetryable()).isTrue();
        assertThat(e.getRetryAfterSeconds()).isEqualTo(600);
        assertThat(e.getResetTime()).isEqualTo(NOW.plusSeconds(600));
        assertThat(e.getMessage()).endsWith("10분 후에 다시 시도해주세요.");
    }
}
