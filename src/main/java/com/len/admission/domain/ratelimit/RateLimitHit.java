package com.len.admission.domain.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * 요청 한 번을 윈도우에 반영한 결과. window 는 저장된 (갱신 후) 상태.
 */
public record RateLimitHit(boolean allowed, RateLimitWindow window) {

    /**
     * 고정 윈도우 규칙.
     * 윈도우가 없거나 끝났으면 count=1 로 새로 열고, 한도 미만이면 +1, 한도에 닿았으면 그대로 두고 거절.
     * Redis 구현의 Lua 스크립트도 같은 규칙을 따른다.
     */
    public static RateLimitHit apply(RateLimitWindow current, Instant now, int maxRequests, Duration window) {
        if (current == null || current.isExpired(now)) {
            return new RateLimitHit(true, RateLimitWindow.open(now.plus(window)));
        }
        if (current.count() >= maxRequests) {
            return new RateLimitHit(false, current);
        }
        return new RateLimitHit(true, current.increment());
    }
}
