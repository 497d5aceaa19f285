package com.len.admission.infra.redis;

import com.len.admission.domain.ratelimit.RateLimitHit;
import com.len.admission.domain.ratelimit.RateLimitStats;
import com.len.admission.domain.ratelimit.RateLimitStore;
import com.len.admission.domain.ratelimit.RateLimitWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 멀티 인스턴스용 rate limit 저장소.
 * hash: otp:rate:{key} -> {count, resetAt(epoch ms)}
 * 판정과 갱신을 Lua 한 번으로 처리한다 (RateLimitHit.apply 와 같은 규칙).
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "admission.rate-limit.store", havingValue = "redis")
public class RedisRateLimitStore implements RateLimitStore {

    static final String KEY_PREFIX = "otp:rate:";
    private static final String FIELD_COUNT = "count";
    private static final String FIELD_RESET_AT = "resetAt";

    // 윈도우 판정은 now > resetTime 이므로 resetTime 직후까지 키를 남긴다
    private static final long EXPIRE_GRACE_MS = 1000L;

    // ARGV: now(ms), maxRequests, 새 윈도우 resetAt(ms), 새 윈도우 만료 시각(ms)
    // 반환: "allowed:count:resetAt"
    private static final RedisScript<String> HIT_SCRIPT = RedisScript.of("""
            local count = redis.call('HGET', KEYS[1], 'count')
            local resetAt = redis.call('HGET', KEYS[1], 'resetAt')
            if (not count) or (not resetAt) or tonumber(ARGV[1]) > tonumber(resetAt) then
              redis.call('HSET', KEYS[1], 'count', '1', 'resetAt', ARGV[3])
              redis.call('PEXPIREAT', KEYS[1], ARGV[4])
              return '1:1:' .. ARGV[3]
            end
            if tonumber(count) >= tonumber(ARGV[2]) then
              return '0:' .. count .. ':' .. resetAt
            end
            local incremented = redis.call('HINCRBY', KEYS[1], 'count', 1)
            return '1:' .. incremented .. ':' .. resetAt
            """, String.class);

    private final StringRedisTemplate redis;

    static String redisKey(String key) {
        return KEY_PREFIX + key;
    }

    @Override
    public Optional<RateLimitWindow> find(String key) {
        Map<Object, Object> raw = redis.opsForHash().entries(redisKey(key));
        return Optional.ofNullable(parse(raw));
    }

    @Override
    public RateLimitHit hit(String key, Instant now, int maxRequests, Duration window) {
        long resetAt = now.plus(window).toEpochMilli();
        String reply = redis.execute(
                HIT_SCRIPT,
                List.of(redisKey(key)),
                String.valueOf(now.toEpochMilli()),
                String.valueOf(maxRequests),
                String.valueOf(resetAt),
                String.valueOf(resetAt + EXPIRE_GRACE_MS)
        );
        if (reply == null) {
            throw new IllegalStateException("rate limit script returned nothing. key=" + key);
        }

        String[] parts = reply.split(":");
        return new RateLimitHit(
                "1".equals(parts[0]),
                new RateLimitWindow(Integer.parseInt(parts[1]), Instant.ofEpochMilli(Long.parseLong(parts[2])))
        );
    }

    /**
     * Redis 키 TTL 로 자동 만료되므로 따로 지울 것이 없다.
     */
    @Override
    public int removeExpired(Instant now) {
        return 0;
    }

    @Override
    public RateLimitStats stats(Instant now) {
        int total = 0;
        int active = 0;
        ScanOptions options = ScanOptions.scanOptions().match(KEY_PREFIX + "*").count(500).build();
        try (Cursor<String> keys = redis.scan(options)) {
            while (keys.hasNext()) {
                RateLimitWindow w = parse(redis.opsForHash().entries(keys.next()));
                if (w == null) {
                    continue;
                }
                total++;
                if (!w.isExpired(now)) {
                    active++;
                }
            }
        }
        return new RateLimitStats(total, active);
    }

    private static RateLimitWindow parse(Map<Object, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        Object count = raw.get(FIELD_COUNT);
        Object resetAt = raw.get(FIELD_RESET_AT);
        if (count == null || resetAt == null) {
            return null;
        }
        return new RateLimitWindow(
                Integer.parseInt(count.toString()),
                Instant.ofEpochMilli(Long.parseLong(resetAt.toString()))
        );
    }
}
