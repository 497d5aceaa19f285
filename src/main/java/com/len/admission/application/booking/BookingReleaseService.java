package com.len.admission.application.booking;

import com.len.admission.application.admission.AdmissionService;
import com.len.admission.application.lock.SlotLockTemplate;
import com.len.admission.common.exception.BusinessException;
import com.len.admission.common.exception.ErrorCode;
import com.len.admission.domain.booking.Booking;
import com.len.admission.domain.booking.BookingStatus;
import com.len.admission.domain.booking.BookingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 확정 예약 해제(취소/노쇼) 후 같은 슬롯 대기 1순위 승격.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingReleaseService {

    private final BookingStore bookingStore;
    private final SlotLockTemplate slotLockTemplate;
    private final AdmissionService admissionService;
    private final Clock clock;

    public ReleaseResult cancel(long bookingId) {
        return release(bookingId, BookingStatus.CANCELLED);
    }

    public ReleaseResult markNoShow(long bookingId) {
        return release(bookingId, BookingStatus.NO_SHOW);
    }

    private ReleaseResult release(long bookingId, BookingStatus target) {
        // 락 키(slotId)를 알아야 하므로 먼저 한 번 조회
        long slotId = bookingStore.findBooking(bookingId)
                .map(Booking::getSlotId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND));

        Booking released = slotLockTemplate.execute(slotId, () -> {
            Booking booking = bookingStore.findBooking(bookingId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND));
            if (booking.getStatus() != BookingStatus.CONFIRMED) {
                throw new BusinessException(ErrorCode.BOOKING_NOT_RELEASABLE);
            }
            booking.release(target, LocalDateTime.now(clock));
            return bookingStore.save(booking);
        });

        log.info("Booking released. bookingId={}, slotId={}, status={}", bookingId, slotId, target);

        Optional<Booking> promoted = admissionService.promoteNext(slotId);
        return new ReleaseResult(released, promoted.orElse(null));
    }

    public record ReleaseResult(Booking released, Booking promoted) {}
}
