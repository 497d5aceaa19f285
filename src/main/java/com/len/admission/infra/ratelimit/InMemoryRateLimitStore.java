package com.len.admission.infra.ratelimit;

import com.len.admission.domain.ratelimit.RateLimitHit;
import com.len.admission.domain.ratelimit.RateLimitStats;
import com.len.admission.domain.ratelimit.RateLimitStore;
import com.len.admission.domain.ratelimit.RateLimitWindow;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

@Component
@ConditionalOnProperty(name = "admission.rate-limit.store", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryRateLimitStore implements RateLimitStore {

    private final ConcurrentHashMap<String, RateLimitWindow> windows = new ConcurrentHashMap<>();

    @Override
    public Optional<RateLimitWindow> find(String key) {
        return Optional.ofNullable(windows.get(key));
    }

    @Override
    public RateLimitHit hit(String key, Instant now, int maxRequests, Duration window) {
        AtomicReference<RateLimitHit> hit = new AtomicReference<>();
        windows.compute(key, (k, current) -> {
            RateLimitHit applied = RateLimitHit.apply(current, now, maxRequests, window);
            hit.set(applied);
            return applied.window();
        });
        return hit.get();
    }

    @Override
    public int removeExpired(Instant now) {
        AtomicInteger removed = new AtomicInteger();
        for (String key : windows.keySet()) {
            // hit 과 경합해도 key 단위로 원자적
            windows.computeIfPresent(key, (k, w) -> {
                if (w.resetTime().isBefore(now)) {
                    removed.incrementAndGet();
                    return null;
                }
                return w;
            });
        }
        return removed.get();
    }

    @Override
    public RateLimitStats stats(Instant now) {
        int total = 0;
        int active = 0;
        for (RateLimitWindow w : windows.values()) {
            total++;
            if (!w.isExpired(now)) {
                active++;
            }
        }
        return new RateLimitStats(total, active);
    }

    public int size() {
        return windows.size();
    }
}
