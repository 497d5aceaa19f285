package com.len.admission.infra.redis;

import com.len.admission.common.exception.BusinessException;
import com.len.admission.common.exception.ErrorCode;
import com.len.admission.domain.lock.SlotLockManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 멀티 인스턴스용 슬롯 락 (SET NX PX + 토큰 비교 삭제).
 * 같은 스레드가 이미 잡은 슬롯이면 Redis 를 다시 타지 않는다 (재진입).
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "admission.lock.mode", havingValue = "redis")
public class RedisSlotLockManager implements SlotLockManager {

    private static final String LOCK_PREFIX = "admission:slot-lock:";

    private final StringRedisTemplate redis;
    private final Duration lockTtl;
    private final Duration acquireTimeout;

    private final ThreadLocal<Set<Long>> held = ThreadLocal.withInitial(HashSet::new);

    // 내가 잡은 락일 때만 지움
    private final RedisScript<Long> unlockScript = RedisScript.of(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then return redis.call('DEL', KEYS[1]) else return 0 end",
            Long.class
    );

    public RedisSlotLockManager(
            StringRedisTemplate redis,
            @Value("${admission.lock.redis.ttl:PT10S}") Duration lockTtl,
            @Value("${admission.lock.acquire-timeout:PT3S}") Duration acquireTimeout
    ) {
        this.redis = redis;
        this.lockTtl = lockTtl;
        this.acquireTimeout = acquireTimeout;
    }

    static String lockKey(long slotId) {
        return LOCK_PREFIX + slotId;
    }

    @Override
    public <T> T executeWithLock(long slotId, Supplier<T> action) {
        Set<Long> mine = held.get();
        if (mine.contains(slotId)) {
            return action.get();
        }

        String token = acquire(slotId);
        mine.add(slotId);
        try {
            return action.get();
        } finally {
            mine.remove(slotId);
            if (mine.isEmpty()) {
                held.remove();
            }
            release(slotId, token);
        }
    }

    @Override
    public String name() {
        return "redis";
    }

    private String acquire(long slotId) {
        String key = lockKey(slotId);
        String token = UUID.randomUUID().toString();
        long deadline = System.nanoTime() + acquireTimeout.toNanos();
        long backoffMs = 5;

        while (true) {
            Boolean ok = redis.opsForValue().setIfAbsent(key, token, lockTtl);
            if (Boolean.TRUE.equals(ok)) {
                return token;
            }
            if (System.nanoTime() >= deadline) {
                log.warn("Slot lock acquire timeout. slotId={}, waitedMs={}", slotId, acquireTimeout.toMillis());
                throw new BusinessException(ErrorCode.SLOT_BUSY);
            }
            try {
                Thread.sleep(backoffMs);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new BusinessException(ErrorCode.SLOT_BUSY, "slot lock wait interrupted");
            }
            backoffMs = Math.min(backoffMs * 2, 50);
        }
    }

    private void release(long slotId, String token) {
        try {
            Long deleted = redis.execute(unlockScript, List.of(lockKey(slotId)), token);
            if (deleted == null || deleted == 0L) {
                // TTL 이 먼저 끝났다는 뜻. 작업 시간이 lock ttl 보다 길었음
                log.warn("Slot lock already expired before release. slotId={}, ttlMs={}", slotId, lockTtl.toMillis());
            }
        } catch (RuntimeException e) {
            // 해제 실패해도 TTL 로 풀린다
            log.error("Slot lock release failed. slotId={}", slotId, e);
        }
    }
}
