package com.len.admission.application.notification;

import com.len.admission.application.waitlist.WaitlistPosition;
import com.len.admission.domain.booking.Booking;
import com.len.admission.domain.notification.NotificationDispatcher;
import com.len.admission.domain.notification.NotificationKind;
import com.len.admission.domain.notification.NotificationPayload;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 알림은 best-effort.
 * 발송 실패는 로그 + 카운트만 남기고 호출자(예약/대기/스윕)에게 절대 전파하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdmissionNotifier {

    static final String METRIC_SENT = "admission.notification.sent";
    static final String METRIC_FAILED = "admission.notification.failed";

    private final NotificationDispatcher dispatcher;
    private final MeterRegistry meterRegistry;

    public void waitlisted(WaitlistPosition position) {
        send(position.studentId(), NotificationKind.WAITLISTED, new NotificationPayload(
                position.slotId(),
                null,
                position.priority(),
                position.expiresAt(),
                "대기열에 등록되었습니다. 현재 순번: " + position.priority()
        ));
    }

    public void promoted(Booking booking) {
        send(booking.getStudentId(), NotificationKind.PROMOTED, new NotificationPayload(
                booking.getSlotId(),
                booking.getId(),
                null,
                null,
                "대기하던 슬롯의 예약이 확정되었습니다."
        ));
    }

    public void expired(WaitlistPosition position) {
        send(position.studentId(), NotificationKind.EXPIRED, new NotificationPayload(
                position.slotId(),
                null,
                null,
                position.expiresAt(),
                "대기 신청이 만료되었습니다. 자리가 남아 있다면 다시 예약해주세요."
        ));
    }

    private void send(long studentId, NotificationKind kind, NotificationPayload payload) {
        try {
            dispatcher.notify(studentId, kind, payload);
            meterRegistry.counter(METRIC_SENT, "kind", kind.name()).increment();
        } catch (Exception e) {
            meterRegistry.counter(METRIC_FAILED, "kind", kind.name()).increment();
            log.warn("Notification dispatch failed. studentId={}, kind={}, slotId={}",
                    studentId, kind, payload.slotId(), e);
        }
    }
}
