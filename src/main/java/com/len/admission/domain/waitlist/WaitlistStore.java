package com.len.admission.domain.waitlist;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface WaitlistStore {

    /**
     * 만료되지 않은 항목, priority 오름차순 (동순위면 createdAt, id 순)
     */
    List<WaitlistEntry> findActiveBySlot(long slotId, LocalDateTime now);

    /**
     * 만료되지 않은 항목, createdAt 내림차순
     */
    List<WaitlistEntry> findActiveByStudent(long studentId, LocalDateTime now);

    /**
     * 만료 여부와 무관하게 (student, slot) 항목 조회
     */
    Optional<WaitlistEntry> findByStudentAndSlot(long studentId, long slotId);

    List<WaitlistEntry> findExpiredBySlot(long slotId, LocalDateTime now);

    /**
     * 만료 항목을 가진 슬롯 id 목록. afterSlotId 보다 큰 id 를 오름차순으로 최대 limit 개
     */
    List<Long> findSlotIdsWithExpired(LocalDateTime now, long afterSlotId, int limit);

    WaitlistEntry save(WaitlistEntry entry);

    void delete(WaitlistEntry entry);
}
