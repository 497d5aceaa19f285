package com.len.admission.support;

import com.len.admission.domain.waitlist.WaitlistEntry;
import com.len.admission.domain.waitlist.WaitlistStore;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JPA 쿼리와 같은 정렬 / 만료 기준을 가진 대기열 저장소
 */
public class InMemoryWaitlistStore implements WaitlistStore {

    private static final Comparator<WaitlistEntry> SLOT_ORDER = Comparator
            .comparingInt(WaitlistEntry::getPriority)
            .thenComparing(WaitlistEntry::getCreatedAt)
            .thenComparing(WaitlistEntry::getId);

    private final Map<Long, WaitlistEntry> entries = new LinkedHashMap<>();
    private final AtomicLong seq = new AtomicLong();

    @Override
    public synchronized List<WaitlistEntry> findActiveBySlot(long slotId, LocalDateTime now) {
        List<WaitlistEntry> result = new ArrayList<>();
        for (WaitlistEntry e : entries.values()) {
            if (e.getSlotId() == slotId && !e.isExpired(now)) {
                result.add(e);
            }
        }
        result.sort(SLOT_ORDER);
        return result;
    }

    @Override
    public synchronized List<WaitlistEntry> findActiveByStudent(long studentId, LocalDateTime now) {
        List<WaitlistEntry> result = new ArrayList<>();
        for (WaitlistEntry e : entries.values()) {
            if (e.getStudentId() == studentId && !e.isExpired(now)) {
                result.add(e);
            }
        }
        result.sort(Comparator.comparing(WaitlistEntry::getCreatedAt).reversed()
                .thenComparing(WaitlistEntry::getId, Comparator.reverseOrder()));
        return result;
    }

    @Override
    public synchronized Optional<WaitlistEntry> findByStudentAndSlot(long studentId, long slotId) {
        return entries.values().stream()
                .filter(e -> e.getStudentId() == studentId && e.getSlotId() == slotId)
                .findFirst();
    }

    @Override
    public synchronized List<WaitlistEntry> findExpiredBySlot(long slotId, LocalDateTime now) {
        List<WaitlistEntry> result = new ArrayList<>();
        for (WaitlistEntry e : entries.values()) {
            if (e.getSlotId() == slotId && e.isExpired(now)) {
                result.add(e);
            }
        }
        result.sort(SLOT_ORDER);
        return result;
    }

    @Override
    public synchronized List<Long> findSlotIdsWithExpired(LocalDateTime now, long afterSlotId, int limit) {
        return entries.values().stream()
                .filter(e -> e.isExpired(now) && e.getSlotId() > afterSlotId)
                .map(WaitlistEntry::getSlotId)
                .distinct()
                .sorted()
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized WaitlistEntry save(WaitlistEntry entry) {
        if (entry.getId() == null) {
            boolean clash = entries.values().stream()
                    .anyMatch(e -> e.getStudentId().equals(entry.getStudentId())
                            && e.getSlotId().equals(entry.getSlotId()));
            if (clash) {
                throw new IllegalStateException("uk_waitlist_student_slot violated");
            }
            ReflectionTestUtils.setField(entry, "id", seq.incrementAndGet());
        }
        entries.put(entry.getId(), entry);
        return entry;
    }

    @Override
    public synchronized void delete(WaitlistEntry entry) {
        entries.remove(entry.getId());
    }

    public synchronized int size() {
        return entries.size();
    }
}
