package com.len.admission.infra.waitlist;

import com.len.admission.domain.waitlist.WaitlistEntry;
import com.len.admission.domain.waitlist.WaitlistStore;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@RequiredArgsConstructor
@Component
public class JpaWaitlistStore implements WaitlistStore {

    private final WaitlistEntryJpaRepository repository;

    @Override
    public List<WaitlistEntry> findActiveBySlot(long slotId, LocalDateTime now) {
        return repository.findActiveBySlot(slotId, now);
    }

    @Override
    public List<WaitlistEntry> findActiveByStudent(long studentId, LocalDateTime now) {
        return repository.findActiveByStudent(studentId, now);
    }

    @Override
    public Optional<WaitlistEntry> findByStudentAndSlot(long studentId, long slotId) {
        return repository.findByStudentIdAndSlotId(studentId, slotId);
    }

    @Override
    public List<WaitlistEntry> findExpiredBySlot(long slotId, LocalDateTime now) {
        return repository.findExpiredBySlot(slotId, now);
    }

    @Override
    public List<Long> findSlotIdsWithExpired(LocalDateTime now, long afterSlotId, int limit) {
        return repository.findSlotIdsWithExpired(now, afterSlotId, PageRequest.of(0, limit));
    }

    @Override
    public WaitlistEntry save(WaitlistEntry entry) {
        return repository.save(entry);
    }

    @Override
    public void delete(WaitlistEntry entry) {
        repository.delete(entry);
        // ⚠️ 같은 트랜잭션에서 (student, slot) 재등록 insert 가 delete 보다 먼저 flush 되면
        // uk_waitlist_student_slot 위반 -> delete 를 즉시 반영
        repository.flush();
    }
}
