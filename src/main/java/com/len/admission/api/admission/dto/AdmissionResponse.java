package com.len.admission.api.admission.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.len.admission.application.admission.AdmissionResult;

// BOOKED 면 booking, WAITLISTED 면 waitlist 만 채워진다
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdmissionResponse(
        AdmissionResult.Outcome outcome,
        BookingResponse booking,
        WaitlistEntryResponse waitlist
) {
    public static AdmissionResponse from(AdmissionResult result) {
        if (result.isBooked()) {
            return new AdmissionResponse(result.outcome(), BookingResponse.from(result.booking()), null);
        }
        return new AdmissionResponse(result.outcome(), null, WaitlistEntryResponse.from(result.waitlistPosition()));
    }
}
