package com.len.admission.application.admission;

import com.len.admission.application.waitlist.WaitlistPosition;
import com.len.admission.domain.booking.Booking;

/**
 * requestSeat 결과: 바로 확정(BOOKED)되었거나 대기열(WAITLISTED)에 들어갔거나.
 */
public record AdmissionResult(
        Outcome outcome,
        Booking booking,                  // BOOKED 일 때만
        WaitlistPosition waitlistPosition // WAITLISTED 일 때만
) {
    public enum Outcome { BOOKED, WAITLISTED }

    public static AdmissionResult booked(Booking booking) {
        return new AdmissionResult(Outcome.BOOKED, booking, null);
    }

    public static AdmissionResult waitlisted(WaitlistPosition position) {
        return new AdmissionResult(Outcome.WAITLISTED, null, position);
    }

    public boolean isBooked() {
        return outcome == Outcome.BOOKED;
    }
}
