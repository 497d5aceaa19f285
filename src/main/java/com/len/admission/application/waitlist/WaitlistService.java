package com.len.admission.application.waitlist;

import com.len.admission.application.capacity.CapacityLedger;
import com.len.admission.application.lock.SlotLockTemplate;
import com.len.admission.common.exception.BusinessException;
import com.len.admission.common.exception.ErrorCode;
import com.len.admission.domain.booking.BookingStore;
import com.len.admission.domain.slot.SlotInfo;
import com.len.admission.domain.waitlist.WaitlistEntry;
import com.len.admission.domain.waitlist.WaitlistStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 슬롯별 대기열.
 *
 * 변경 연산(enqueue / leave / popNext / evictExpired / discard)은 모두 슬롯 락 안에서 실행되고,
 * 끝나기 전에 해당 슬롯의 유효 항목 priority 를 1..N 으로 다시 매긴다.
 * 만료 항목은 스윕 전까지 테이블에 남아 있을 수 있으므로 조회 결과의 priority 는 조회 순서로 계산한다.
 */
@Slf4j
@Service
public class WaitlistService {

    private final WaitlistStore waitlistStore;
    private final BookingStore bookingStore;
    private final CapacityLedger capacityLedger;
    private final SlotLockTemplate slotLockTemplate;
    private final Clock clock;
    private final Duration ttl;

    public WaitlistService(
            WaitlistStore waitlistStore,
            BookingStore bookingStore,
            CapacityLedger capacityLedger,
            SlotLockTemplate slotLockTemplate,
            Clock clock,
            @Value("${admission.waitlist.ttl:PT24H}") Duration ttl
    ) {
        this.waitlistStore = waitlistStore;
        this.bookingStore = bookingStore;
        this.capacityLedger = capacityLedger;
        this.slotLockTemplate = slotLockTemplate;
        this.clock = clock;
        this.ttl = ttl;
    }

    public WaitlistPosition enqueue(long studentId, long slotId) {
        return slotLockTemplate.execute(slotId, () -> {
            LocalDateTime now = LocalDateTime.now(clock);

            SlotInfo slot = bookingStore.getSlot(slotId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.SLOT_NOT_FOUND));
            if (slot.hasStarted(now)) {
                throw new BusinessException(ErrorCode.SLOT_IN_PAST);
            }

            Optional<WaitlistEntry> existing = waitlistStore.findByStudentAndSlot(studentId, slotId);
            if (existing.isPresent()) {
                if (!existing.get().isExpired(now)) {
                    throw new BusinessException(ErrorCode.ALREADY_WAITLISTED);
                }
                // 스윕 전에 남아 있던 만료 항목. 재등록이므로 만료 알림 없이 정리
                waitlistStore.delete(existing.get());
                log.debug("Stale waitlist entry replaced. studentId={}, slotId={}, entryId={}",
                        studentId, slotId, existing.get().getId());
            }

            if (bookingStore.hasActiveBooking(studentId, slotId)) {
                throw new BusinessException(ErrorCode.ALREADY_BOOKED);
            }

            // 보통은 꽉 찬 슬롯에만 들어온다. 막지는 않고 기록만
            if (capacityLedger.hasCapacity(slotId)) {
                log.warn("Waitlist enqueue on slot with free seats. studentId={}, slotId={}, remaining={}",
                        studentId, slotId, capacityLedger.remainingSeats(slotId));
            }

            List<WaitlistEntry> active = renumber(slotId, now);
            WaitlistEntry saved = waitlistStore.save(
                    WaitlistEntry.newEntry(studentId, slotId, active.size() + 1, now, ttl)
            );

            log.info("Waitlisted. studentId={}, slotId={}, position={}, expiresAt={}",
                    studentId, slotId, saved.getPriority(), saved.getExpiresAt());
            return WaitlistPosition.of(saved);
        });
    }

    public void leave(long studentId, long slotId) {
        slotLockTemplate.executeWithoutResult(slotId, () -> {
            LocalDateTime now = LocalDateTime.now(clock);

            WaitlistEntry entry = waitlistStore.findByStudentAndSlot(studentId, slotId)
                    .filter(e -> !e.isExpired(now))
                    .orElseThrow(() -> new BusinessException(ErrorCode.NOT_WAITLISTED));

            waitlistStore.delete(entry);
            renumber(slotId, now);

            log.info("Left waitlist. studentId={}, slotId={}, formerPriority={}",
                    studentId, slotId, entry.getPriority());
        });
    }

    /**
     * 선두 항목을 꺼낸다. 만료 항목은 건너뛴다 (꺼내지도 않음).
     */
    public Optional<WaitlistPosition> popNext(long slotId) {
        return slotLockTemplate.execute(slotId, () -> {
            LocalDateTime now = LocalDateTime.now(clock);

            List<WaitlistEntry> active = waitlistStore.findActiveBySlot(slotId, now);
            if (active.isEmpty()) {
                return Optional.<WaitlistPosition>empty();
            }

            WaitlistEntry head = active.get(0);
            WaitlistPosition popped = WaitlistPosition.of(head, 1);
            waitlistStore.delete(head);
            renumber(slotId, now);
            return Optional.of(popped);
        });
    }

    /**
     * 학생이 대기 없이 직접 좌석을 잡은 경우 자기 대기 항목을 조용히 정리한다.
     * @return 지운 항목이 있으면 true
     */
    public boolean discard(long studentId, long slotId) {
        return slotLockTemplate.execute(slotId, () -> {
            LocalDateTime now = LocalDateTime.now(clock);

            Optional<WaitlistEntry> entry = waitlistStore.findByStudentAndSlot(studentId, slotId)
                    .filter(e -> !e.isExpired(now));
            if (entry.isEmpty()) {
                return false;
            }
            waitlistStore.delete(entry.get());
            renumber(slotId, now);
            return true;
        });
    }

    /**
     * 해당 슬롯의 만료 항목만 지우고 그 슬롯만 다시 번호를 매긴다.
     */
    public List<WaitlistPosition> evictExpired(long slotId) {
        return slotLockTemplate.execute(slotId, () -> {
            LocalDateTime now = LocalDateTime.now(clock);

            List<WaitlistEntry> expired = waitlistStore.findExpiredBySlot(slotId, now);
            if (expired.isEmpty()) {
                return List.<WaitlistPosition>of();
            }

            List<WaitlistPosition> removed = new ArrayList<>(expired.size());
            for (WaitlistEntry e : expired) {
                removed.add(WaitlistPosition.of(e));
                waitlistStore.delete(e);
            }
            renumber(slotId, now);
            return removed;
        });
    }

    @Transactional(readOnly = true)
    public List<WaitlistPosition> listForSlot(long slotId) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<WaitlistEntry> active = waitlistStore.findActiveBySlot(slotId, now);

        List<WaitlistPosition> result = new ArrayList<>(active.size());
        for (int i = 0; i < active.size(); i++) {
            result.add(WaitlistPosition.of(active.get(i), i + 1));
        }
        return result;
    }

    @Transactional(readOnly = true)
    public List<WaitlistPosition> listForStudent(long studentId) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<WaitlistEntry> mine = waitlistStore.findActiveByStudent(studentId, now);

        // 슬롯별 현재 순번
        Map<Long, List<WaitlistEntry>> queues = new HashMap<>();
        List<WaitlistPosition> result = new ArrayList<>(mine.size());
        for (WaitlistEntry entry : mine) {
            List<WaitlistEntry> queue = queues.computeIfAbsent(entry.getSlotId(),
                    id -> waitlistStore.findActiveBySlot(id, now));
            result.add(WaitlistPosition.of(entry, positionOf(queue, entry)));
        }
        return result;
    }

    /**
     * 유효 항목 priority 를 기존 순서 그대로 1..N 으로 압축. 슬롯 락 안에서만 호출.
     */
    private List<WaitlistEntry> renumber(long slotId, LocalDateTime now) {
        List<WaitlistEntry> active = waitlistStore.findActiveBySlot(slotId, now);
        for (int i = 0; i < active.size(); i++) {
            WaitlistEntry e = active.get(i);
            if (e.getPriority() != i + 1) {
                e.reprioritize(i + 1);
                waitlistStore.save(e);
            }
        }
        return active;
    }

    private static int positionOf(List<WaitlistEntry> queue, WaitlistEntry entry) {
        for (int i = 0; i < queue.size(); i++) {
            if (queue.get(i).getId().equals(entry.getId())) {
                return i + 1;
            }
        }
        // 조회 사이에 빠진 경우
        return entry.getPriority();
    }
}
