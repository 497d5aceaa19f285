package com.len.admission.infra.lock;

import com.len.admission.domain.lock.SlotLockManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 단일 인스턴스용 슬롯 락. 슬롯마다 ReentrantLock 하나.
 * 사용 중인 스레드 수를 세어 0 이 되면 맵에서 제거한다 (슬롯 수만큼 락이 쌓이지 않게).
 */
@Component
@ConditionalOnProperty(name = "admission.lock.mode", havingValue = "in-process", matchIfMissing = true)
public class InProcessSlotLockManager implements SlotLockManager {

    private final ConcurrentHashMap<Long, Holder> locks = new ConcurrentHashMap<>();

    @Override
    public <T> T executeWithLock(long slotId, Supplier<T> action) {
        Holder holder = locks.compute(slotId, (id, h) -> {
            Holder target = (h == null) ? new Holder() : h;
            target.users++;
            return target;
        });

        holder.lock.lock();
        try {
            return action.get();
        } finally {
            holder.lock.unlock();
            locks.computeIfPresent(slotId, (id, h) -> --h.users == 0 ? null : h);
        }
    }

    @Override
    public String name() {
        return "in-process";
    }

    int activeLockCount() {
        return locks.size();
    }

    // users 는 compute 안에서만 바뀐다
    private static final class Holder {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
