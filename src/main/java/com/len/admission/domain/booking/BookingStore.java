package com.len.admission.domain.booking;

import com.len.admission.domain.slot.SlotInfo;

import java.util.Optional;

public interface BookingStore {

    /**
     * 슬롯 조회 (없으면 empty)
     */
    Optional<SlotInfo> getSlot(long slotId);

    /**
     * CONFIRMED + COMPLETED 예약 수
     */
    int countActiveBookings(long slotId);

    /**
     * 학생이 이 슬롯에 CONFIRMED / COMPLETED 예약을 갖고 있으면 true
     */
    boolean hasActiveBooking(long studentId, long slotId);

    Booking createBooking(long studentId, long slotId, BookingStatus status);

    Optional<Booking> findBooking(long bookingId);

    Booking save(Booking booking);
}
