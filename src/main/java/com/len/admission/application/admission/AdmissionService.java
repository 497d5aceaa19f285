package com.len.admission.application.admission;

import com.len.admission.application.capacity.CapacityLedger;
import com.len.admission.application.lock.SlotLockTemplate;
import com.len.admission.application.notification.AdmissionNotifier;
import com.len.admission.application.waitlist.WaitlistPosition;
import com.len.admission.application.waitlist.WaitlistService;
import com.len.admission.common.exception.BusinessException;
import com.len.admission.common.exception.ErrorCode;
import com.len.admission.domain.booking.Booking;
import com.len.admission.domain.booking.BookingStatus;
import com.len.admission.domain.booking.BookingStore;
import com.len.admission.domain.slot.SlotInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 좌석 요청 / 대기 승격 / 대기 취소.
 *
 * ✅ 여기서는 @Transactional 을 쓰지 않는다.
 * - 정원 판단 -> 대기열 pop -> 예약 생성은 SlotLockTemplate 안에서 한 덩어리로 처리
 * - 알림은 락과 트랜잭션이 끝난 뒤에 보낸다 (알림 실패가 좌석 상태를 되돌리지 않게)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdmissionService {

    private final BookingStore bookingStore;
    private final CapacityLedger capacityLedger;
    private final WaitlistService waitlistService;
    private final SlotLockTemplate slotLockTemplate;
    private final AdmissionNotifier notifier;
    private final Clock clock;

    /**
     * 자리가 있으면 바로 확정, 없으면 대기열.
     */
    public AdmissionResult requestSeat(long studentId, long slotId) {
        AdmissionResult result = slotLockTemplate.execute(slotId, () -> admit(studentId, slotId));

        if (result.isBooked()) {
            log.info("Seat booked directly. studentId={}, slotId={}, bookingId={}",
                    studentId, slotId, result.booking().getId());
        } else {
            notifier.waitlisted(result.waitlistPosition());
        }
        return result;
    }

    /**
     * 좌석이 비었을 때(취소/노쇼) 대기 1순위를 확정 예약으로 승격.
     * 빈 좌석이 없거나 대기자가 없으면 empty.
     */
    public Optional<Booking> promoteNext(long slotId) {
        Optional<Booking> promoted = slotLockTemplate.execute(slotId, () -> promote(slotId));

        promoted.ifPresent(booking -> {
            log.info("Promoted from waitlist. studentId={}, slotId={}, bookingId={}",
                    booking.getStudentId(), slotId, booking.getId());
            notifier.promoted(booking);
        });
        return promoted;
    }

    public void withdraw(long studentId, long slotId) {
        waitlistService.leave(studentId, slotId);
    }

    public List<WaitlistPosition> listForSlot(long slotId) {
        return waitlistService.listForSlot(slotId);
    }

    public List<WaitlistPosition> listForStudent(long studentId) {
        return waitlistService.listForStudent(studentId);
    }

    private AdmissionResult admit(long studentId, long slotId) {
        SlotInfo slot = bookingStore.getSlot(slotId)
                .orElseThrow(() -> new BusinessException(ErrorCode.SLOT_NOT_FOUND));
        if (slot.hasStarted(LocalDateTime.now(clock))) {
            throw new BusinessException(ErrorCode.SLOT_IN_PAST);
        }
        if (bookingStore.hasActiveBooking(studentId, slotId)) {
            throw new BusinessException(ErrorCode.ALREADY_BOOKED);
        }

        if (!capacityLedger.hasCapacity(slotId)) {
            return AdmissionResult.waitlisted(waitlistService.enqueue(studentId, slotId));
        }

        // 대기 중이던 학생이 빈자리를 직접 잡으면 대기 항목은 같은 임계 구역에서 정리
        if (waitlistService.discard(studentId, slotId)) {
            log.info("Waitlist entry dropped on direct booking. studentId={}, slotId={}", studentId, slotId);
        }

        Booking booking = bookingStore.createBooking(studentId, slotId, BookingStatus.CONFIRMED);
        ensureWithinCapacity(slot);
        return AdmissionResult.booked(booking);
    }

    private Optional<Booking> promote(long slotId) {
        Optional<SlotInfo> slot = bookingStore.getSlot(slotId);
        if (slot.isEmpty() || !capacityLedger.hasCapacity(slotId)) {
            log.debug("No free seat to promote into. slotId={}", slotId);
            return Optional.empty();
        }

        while (true) {
            Optional<WaitlistPosition> next = waitlistService.popNext(slotId);
            if (next.isEmpty()) {
                return Optional.empty();
            }

            WaitlistPosition entry = next.get();
            if (bookingStore.hasActiveBooking(entry.studentId(), slotId)) {
                // 이미 좌석이 있는 학생은 건너뛰고 다음 순번으로
                log.warn("Skip promotion of student already holding a seat. studentId={}, slotId={}, entryId={}",
                        entry.studentId(), slotId, entry.entryId());
                continue;
            }

            Booking booking = bookingStore.createBooking(entry.studentId(), slotId, BookingStatus.CONFIRMED);
            ensureWithinCapacity(slot.get());
            return Optional.of(booking);
        }
    }

    /**
     * 락이 있어도 재집계로 한 번 더 확인한다.
     * 초과면 예외 -> 트랜잭션 롤백 (예약 insert / 대기열 pop 모두 취소)
     */
    private void ensureWithinCapacity(SlotInfo slot) {
        int confirmed = bookingStore.countActiveBookings(slot.id());
        if (confirmed > slot.capacity()) {
            log.error("Capacity exceeded, rolling back. slotId={}, confirmed={}, capacity={}",
                    slot.id(), confirmed, slot.capacity());
            throw new BusinessException(ErrorCode.CAPACITY_EXCEEDED);
        }
    }
}
