package com.len.admission.infra.booking;

import com.len.admission.domain.booking.Booking;
import com.len.admission.domain.booking.BookingStatus;
import com.len.admission.domain.booking.BookingStore;
import com.len.admission.domain.slot.Slot;
import com.len.admission.domain.slot.SlotInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@RequiredArgsConstructor
@Component
public class JpaBookingStore implements BookingStore {

    private final SlotJpaRepository slotRepository;
    private final BookingJpaRepository bookingRepository;
    private final Clock clock;

    @Override
    public Optional<SlotInfo> getSlot(long slotId) {
        return slotRepository.findById(slotId).map(Slot::toInfo);
    }

    @Override
    public int countActiveBookings(long slotId) {
        return (int) bookingRepository.countBySlotIdAndStatusIn(slotId, BookingStatus.OCCUPYING);
    }

    @Override
    public boolean hasActiveBooking(long studentId, long slotId) {
        return bookingRepository.existsByStudentIdAndSlotIdAndStatusIn(studentId, slotId, BookingStatus.OCCUPYING);
    }

    @Override
    public Booking createBooking(long studentId, long slotId, BookingStatus status) {
        Booking booking = Booking.create(studentId, slotId, status, LocalDateTime.now(clock));
        // 바로 flush 해야 같은 트랜잭션의 재집계(count)에 반영된다
        return bookingRepository.saveAndFlush(booking);
    }

    @Override
    public Optional<Booking> findBooking(long bookingId) {
        return bookingRepository.findById(bookingId);
    }

    @Override
    public Booking save(Booking booking) {
        return bookingRepository.saveAndFlush(booking);
    }
}
