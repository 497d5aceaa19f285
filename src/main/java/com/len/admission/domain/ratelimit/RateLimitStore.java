package com.len.admission.domain.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public interface RateLimitStore {

    Optional<RateLimitWindow> find(String key);

    /**
     * key 단위로 원자적으로 {@link RateLimitHit#apply} 를 적용하고 저장.
     */
    RateLimitHit hit(String key, Instant now, int maxRequests, Duration window);

    /**
     * resetTime < now 인 윈도우 삭제
     * @return 삭제 건수
     */
    int removeExpired(Instant now);

    RateLimitStats stats(Instant now);
}
