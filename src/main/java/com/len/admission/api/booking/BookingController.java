package com.len.admission.api.booking;

import com.len.admission.api.admission.dto.BookingResponse;
import com.len.admission.application.booking.BookingReleaseService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/bookings")
public class BookingController {

    private final BookingReleaseService bookingReleaseService;

    @PostMapping("/{bookingId}/cancel")
    public ReleaseResponse cancel(@PathVariable Long bookingId) {
        return ReleaseResponse.from(bookingReleaseService.cancel(bookingId));
    }

    @PostMapping("/{bookingId}/no-show")
    public ReleaseResponse noShow(@PathVariable Long bookingId) {
        return ReleaseResponse.from(bookingReleaseService.markNoShow(bookingId));
    }

    public record ReleaseResponse(BookingResponse released, BookingResponse promoted) {
        static ReleaseResponse from(BookingReleaseService.ReleaseResult result) {
            return new ReleaseResponse(
                    BookingResponse.from(result.released()),
                    result.promoted() == null ? null : BookingResponse.from(result.promoted())
            );
        }
    }
}
