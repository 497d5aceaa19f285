package com.len.admission.api.admission.dto;

import com.len.admission.domain.booking.Booking;
import com.len.admission.domain.booking.BookingStatus;

import java.time.LocalDateTime;

public record BookingResponse(
        Long bookingId,
        Long studentId,
        Long slotId,
        BookingStatus status,
        LocalDateTime createdAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getStudentId(),
                booking.getSlotId(),
                booking.getStatus(),
                booking.getCreatedAt()
        );
    }
}
