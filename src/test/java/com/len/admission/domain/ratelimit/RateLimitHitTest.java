package com.len.admission.domain.ratelimit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitHitTest {

    private static final Instant NOW = Instant.parse("2026-03-02T00:00:00Z");
    private static final Duration WINDOW = Duration.ofHours(1);

    @Test
    @DisplayName("한도에 닿으면 거절, 카운트는 그대로")
    void atLimit_deniedWithoutIncrement() {
        RateLimitWindow full = new RateLimitWindow(5, NOW.plusSeconds(30));

        RateLimitHit hit = RateLimitHit.apply(full, NOW, 5, WINDOW);

        assertThat(hit.allowed()).isFalse();
        assertThat(hit.window()).isSameAs(full);
    }

    @Test
    @DisplayName("resetTime 그 순간은 아직 같은 윈도우, 1ms 뒤에 새 윈도우")
    void resetBoundary() {
        RateLimitWindow full = new RateLimitWindow(5, NOW);

        assertThat(RateLimitHit.apply(full, NOW, 5, WINDOW).allowed()).isFalse();

        RateLimitHit after = RateLimitHit.apply(full, NOW.plusMillis(1), 5, WINDOW);
        assertThat(after.allowed()).isTrue();
        assertThat(after.window()).isEqualTo(new RateLimitWindow(1, NOW.plusMillis(1).plus(WINDOW)));
    }
}
