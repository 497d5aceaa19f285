package com.len.admission.infra.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.len.admission.application.admission.AdmissionService;
import com.len.admission.common.exception.BusinessException;
import com.len.admission.domain.booking.Booking;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 외부 예약 시스템에서 좌석이 풀렸다는 이벤트 -> 대기 1순위 승격.
 * promoteNext 는 자리가 없으면 아무것도 하지 않으므로 중복 수신돼도 안전하다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingReleasedConsumer {

    public static final String TOPIC = "booking.released.v1";

    private static final String METRIC_SKIP = "admission.booking_released.skip";
    private static final String METRIC_PROCESSED = "admission.booking_released.processed";
    private static final String METRIC_RETRYABLE_ERROR = "admission.booking_released.retryable_error";

    private final ObjectMapper objectMapper;
    private final AdmissionService admissionService;
    private final MeterRegistry meterRegistry;

    @KafkaListener(
            topics = TOPIC,
            groupId = "${spring.kafka.consumer.group-id}"
    )
    public void onMessage(String payload) {
        BookingReleasedPayload evt;

        // 1) JSON 파싱
        try {
            evt = objectMapper.readValue(payload, BookingReleasedPayload.class);
        } catch (Exception e) {
            countSkip("invalid_payload");
            log.warn("Skip invalid payload. payload={}", payload, e);
            return;
        }

        // 2) 필수 필드
        if (evt.eventId() == null || evt.eventId().isBlank() || evt.slotId() == null) {
            countSkip("invalid_fields");
            log.warn("Skip invalid event fields. event={}", evt);
            return;
        }

        // 3) 승격
        try {
            Optional<Booking> promoted = admissionService.promoteNext(evt.slotId());
            if (promoted.isEmpty()) {
                countSkip("nothing_to_promote");
                log.debug("Nothing promoted. eventId={}, slotId={}", evt.eventId(), evt.slotId());
                return;
            }
            meterRegistry.counter(METRIC_PROCESSED).increment();
            log.info("Booking released event processed. eventId={}, slotId={}, releasedBookingId={}, promotedBookingId={}",
                    evt.eventId(), evt.slotId(), evt.bookingId(), promoted.get().getId());

        } catch (BusinessException e) {
            if (e.isRetryable()) {
                // 락 대기 초과 등: 재던져서 컨테이너 재시도에 맡김
                meterRegistry.counter(METRIC_RETRYABLE_ERROR).increment();
                log.warn("Retryable promotion error. eventId={}, code={}", evt.eventId(), e.getErrorCode());
                throw e;
            }
            countSkip("business_exception");
            log.warn("Skip non-retryable business error. eventId={}, code={}",
                    evt.eventId(), e.getErrorCode());
        }
    }

    private void countSkip(String reason) {
        meterRegistry.counter(METRIC_SKIP, "reason", reason).increment();
    }
}
