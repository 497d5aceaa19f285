package com.len.admission.api.admission;

import com.len.admission.api.admission.dto.AdmissionResponse;
import com.len.admission.api.admission.dto.BookingResponse;
import com.len.admission.api.admission.dto.WaitlistEntryResponse;
import com.len.admission.application.admission.AdmissionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class AdmissionController {

    private final AdmissionService admissionService;

    @PostMapping("/slots/{slotId}/admissions")
    public AdmissionResponse requestSeat(
            @PathVariable Long slotId,
            @Valid @RequestBody AdmissionRequest request
    ) {
        return AdmissionResponse.from(admissionService.requestSeat(request.studentId(), slotId));
    }

    @DeleteMapping("/slots/{slotId}/waitlist/{studentId}")
    public ResponseEntity<Void> withdraw(@PathVariable Long slotId, @PathVariable Long studentId) {
        admissionService.withdraw(studentId, slotId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/slots/{slotId}/waitlist")
    public List<WaitlistEntryResponse> slotWaitlist(@PathVariable Long slotId) {
        return admissionService.listForSlot(slotId).stream()
                .map(WaitlistEntryResponse::from)
                .toList();
    }

    @GetMapping("/students/{studentId}/waitlist")
    public List<WaitlistEntryResponse> studentWaitlist(@PathVariable Long studentId) {
        return admissionService.listForStudent(studentId).stream()
                .map(WaitlistEntryResponse::from)
                .toList();
    }

    // 승격할 대기자가 없거나 빈 좌석이 없으면 204
    @PostMapping("/slots/{slotId}/promotions")
    public ResponseEntity<BookingResponse> promote(@PathVariable Long slotId) {
        return admissionService.promoteNext(slotId)
                .map(booking -> ResponseEntity.ok(BookingResponse.from(booking)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    public record AdmissionRequest(@NotNull Long studentId) {}
}
