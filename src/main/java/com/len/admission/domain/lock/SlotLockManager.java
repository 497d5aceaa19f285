package com.len.admission.domain.lock;

import java.util.function.Supplier;

/**
 * 슬롯 단위 상호 배제. 같은 스레드에서의 재진입을 허용해야 한다.
 * 서로 다른 슬롯끼리는 막지 않는다.
 */
public interface SlotLockManager {

    <T> T executeWithLock(long slotId, Supplier<T> action);

    String name(); // "in-process" | "redis"
}
