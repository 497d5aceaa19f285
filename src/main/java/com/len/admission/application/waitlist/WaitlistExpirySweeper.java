package com.len.admission.application.waitlist;

import com.len.admission.application.notification.AdmissionNotifier;
import com.len.admission.domain.waitlist.WaitlistStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 만료된 대기 항목 정리.
 * 삭제가 기준이고 알림은 best-effort (알림 실패로 삭제를 되돌리지 않음).
 */
@Slf4j
@Service
public class WaitlistExpirySweeper {

    private final WaitlistStore waitlistStore;
    private final WaitlistService waitlistService;
    private final AdmissionNotifier notifier;
    private final Clock clock;
    private final int batchSize;

    public WaitlistExpirySweeper(
            WaitlistStore waitlistStore,
            WaitlistService waitlistService,
            AdmissionNotifier notifier,
            Clock clock,
            @Value("${admission.waitlist.sweep-batch-size:500}") int batchSize
    ) {
        this.waitlistStore = waitlistStore;
        this.waitlistService = waitlistService;
        this.notifier = notifier;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    /**
     * @return 이번 스윕에서 지운 항목 수
     */
    public int sweep() {
        LocalDateTime now = LocalDateTime.now(clock);
        int removed = 0;
        int scannedSlots = 0;
        int failedSlots = 0;

        // 슬롯 id 커서로 페이지를 넘긴다. 실패한 슬롯도 커서 뒤로 지나가므로 같은 슬롯을 다시 잡지 않는다
        long cursor = 0L;
        while (true) {
            List<Long> slotIds = waitlistStore.findSlotIdsWithExpired(now, cursor, batchSize);
            for (long slotId : slotIds) {
                scannedSlots++;
                List<WaitlistPosition> evicted;
                try {
                    // 슬롯 락 안에서 다시 조회 후 삭제 (그 사이 leave/pop 된 항목은 빠짐)
                    evicted = waitlistService.evictExpired(slotId);
                } catch (RuntimeException e) {
                    // 한 슬롯 실패로 나머지 슬롯 스윕을 멈추지 않는다. 다음 틱에 다시 잡힌다
                    failedSlots++;
                    log.error("Waitlist sweep failed for slot. slotId={}", slotId, e);
                    continue;
                }

                removed += evicted.size();
                evicted.forEach(notifier::expired);
            }

            if (slotIds.size() < batchSize) {
                break;
            }
            cursor = slotIds.get(slotIds.size() - 1);
        }

        if (removed > 0 || failedSlots > 0) {
            log.info("[WaitlistSweep] slots={}, removed={}, failedSlots={}", scannedSlots, removed, failedSlots);
        }
        return removed;
    }
}
