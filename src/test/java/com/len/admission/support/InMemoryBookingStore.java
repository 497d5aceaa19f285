package com.len.admission.support;

import com.len.admission.domain.booking.Booking;
import com.len.admission.domain.booking.BookingStatus;
import com.len.admission.domain.booking.BookingStore;
import com.len.admission.domain.slot.SlotInfo;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryBookingStore implements BookingStore {

    private final Map<Long, SlotInfo> slots = new ConcurrentHashMap<>();
    private final Map<Long, Booking> bookings = new ConcurrentHashMap<>();
    private final AtomicLong slotSeq = new AtomicLong();
    private final AtomicLong bookingSeq = new AtomicLong();
    private final Clock clock;

    public InMemoryBookingStore(Clock clock) {
        this.clock = clock;
    }

    public SlotInfo addSlot(int capacity, LocalDateTime startAt) {
        long id = slotSeq.incrementAndGet();
        SlotInfo slot = new SlotInfo(id, capacity, startAt, startAt.plusHours(1));
        slots.put(id, slot);
        return slot;
    }

    @Override
    public Optional<SlotInfo> getSlot(long slotId) {
        return Optional.ofNullable(slots.get(slotId));
    }

    @Override
    public int countActiveBookings(long slotId) {
        return (int) bookings.values().stream()
                .filter(b -> b.getSlotId() == slotId && b.occupiesSeat())
                .count();
    }

    @Override
    public boolean hasActiveBooking(long studentId, long slotId) {
        return bookings.values().stream()
                .anyMatch(b -> b.getSlotId() == slotId && b.getStudentId() == studentId && b.occupiesSeat());
    }

    @Override
    public Booking createBooking(long studentId, long slotId, BookingStatus status) {
        Booking booking = Booking.create(studentId, slotId, status, LocalDateTime.now(clock));
        long id = bookingSeq.incrementAndGet();
        ReflectionTestUtils.setField(booking, "id", id);
        bookings.put(id, booking);
        return booking;
    }

    @Override
    public Optional<Booking> findBooking(long bookingId) {
        return Optional.ofNullable(bookings.get(bookingId));
    }

    @Override
    public Booking save(Booking booking) {
        bookings.put(booking.getId(), booking);
        return booking;
    }
}
