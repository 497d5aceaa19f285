package com.len.admission.application.ratelimit;

import com.len.admission.domain.ratelimit.RateLimitHit;
import com.len.admission.domain.ratelimit.RateLimitStats;
import com.len.admission.domain.ratelimit.RateLimitStore;
import com.len.admission.domain.ratelimit.RateLimitWindow;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * 전화번호별 OTP 요청 제한 (고정 윈도우).
 *
 * 첫 요청 시점부터 window 동안 maxRequests 회까지 허용하고, resetTime 이 지나면 새 윈도우.
 * 슬라이딩 윈도우가 아니라서 경계 전후로 최대 2 * maxRequests 까지 나갈 수 있다 (OTP 남용 방지 용도라 허용).
 */
@Slf4j
@Service
public class OtpRateLimiter {

    private final RateLimitStore store;
    private final Clock clock;

    @Getter
    private final int maxRequests;
    private final Duration window;

    public OtpRateLimiter(
            RateLimitStore store,
            Clock clock,
            @Value("${admission.rate-limit.max-requests:5}") int maxRequests,
            @Value("${admission.rate-limit.window:PT1H}") Duration window
    ) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("max-requests must be positive: " + maxRequests);
        }
        this.store = store;
        this.clock = clock;
        this.maxRequests = maxRequests;
        this.window = window;
    }

    public RateLimitDecision isAllowed(String key) {
        RateLimitHit hit = store.hit(key, clock.instant(), maxRequests, window);
        RateLimitWindow current = hit.window();

        if (!hit.allowed()) {
            log.info("OTP rate limited. key={}, resetTime={}", mask(key), current.resetTime());
            return RateLimitDecision.deny(current.resetTime());
        }
        return RateLimitDecision.allow(maxRequests - current.count(), current.resetTime());
    }

    /**
     * 허용이면 결정 반환, 아니면 RateLimitedException
     */
    public RateLimitDecision requireAllowed(String key) {
        RateLimitDecision decision = isAllowed(key);
        if (!decision.allowed()) {
            reject(decision);
        }
        return decision;
    }

    public void reject(RateLimitDecision decision) {
        throw new RateLimitedException(decision.resetTime(), clock.instant());
    }

    public int cleanup() {
        int removed = store.removeExpired(clock.instant());
        if (removed > 0) {
            log.info("[RateLimitCleanup] removed={}", removed);
        }
        return removed;
    }

    public RateLimitStats stats() {
        return store.stats(clock.instant());
    }

    // 로그에 전화번호 전체를 남기지 않는다
    static String mask(String key) {
        if (key == null || key.length() <= 4) {
            return "****";
        }
        return "*".repeat(key.length() - 4) + key.substring(key.length() - 4);
    }
}
