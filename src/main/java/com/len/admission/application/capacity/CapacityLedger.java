package com.len.admission.application.capacity;

import com.len.admission.domain.booking.BookingStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 슬롯 잔여 좌석 조회 (부수효과 없음)
 */
@Service
@RequiredArgsConstructor
public class CapacityLedger {

    private final BookingStore bookingStore;

    /**
     * 슬롯이 없으면 false (fail closed)
     */
    @Transactional(readOnly = true)
    public boolean hasCapacity(long slotId) {
        return remainingSeats(slotId) > 0;
    }

    @Transactional(readOnly = true)
    public int remainingSeats(long slotId) {
        return bookingStore.getSlot(slotId)
                .map(slot -> Math.max(0, slot.capacity() - bookingStore.countActiveBookings(slotId)))
                .orElse(0);
    }
}
