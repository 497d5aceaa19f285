package com.len.admission.application.lock;

import com.len.admission.domain.lock.SlotLockManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.util.function.Supplier;

/**
 * 슬롯 임계 구역: 락 획득 -> 트랜잭션 시작 -> 작업 -> 커밋 -> 락 해제.
 *
 * ✅ 락을 트랜잭션 바깥에 둔다.
 * 커밋 전에 락을 풀면 다음 요청이 커밋 안 된 상태를 읽고 정원을 초과할 수 있다.
 * 중첩 호출은 락(재진입)과 트랜잭션(REQUIRED) 모두 바깥 것에 합류한다.
 */
@Slf4j
@Component
public class SlotLockTemplate {

    private final SlotLockManager lockManager;
    private final TransactionOperations transactionOperations;

    public SlotLockTemplate(SlotLockManager lockManager, TransactionOperations transactionOperations) {
        this.lockManager = lockManager;
        this.transactionOperations = transactionOperations;
        log.info("Slot lock initialized. mode={}", lockManager.name());
    }

    public <T> T execute(long slotId, Supplier<T> work) {
        return lockManager.executeWithLock(slotId,
                () -> transactionOperations.execute(status -> work.get()));
    }

    public void executeWithoutResult(long slotId, Runnable work) {
        execute(slotId, () -> {
            work.run();
            return null;
        });
    }
}
