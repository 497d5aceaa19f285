package com.len.admission.infra.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.len.admission.application.admission.AdmissionService;
import com.len.admission.common.exception.BusinessException;
import com.len.admission.common.exception.ErrorCode;
import com.len.admission.domain.booking.Booking;
import com.len.admission.domain.booking.BookingStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class BookingReleasedConsumerTest {

    @Mock
    AdmissionService admissionService;

    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    BookingReleasedConsumer consumer;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        consumer = new BookingReleasedConsumer(objectMapper, admissionService, meterRegistry);
    }

    @Test
    @DisplayName("좌석 해제 이벤트 -> 해당 슬롯 승격")
    void onMessage_promotes() {
        given(admissionService.promoteNext(3L)).willReturn(Optional.of(
                Booking.create(20L, 3L, BookingStatus.CONFIRMED, LocalDateTime.of(2026, 3, 2, 9, 0))));

        consumer.onMessage("""
                {"eventId":"ev-1","bookingId":55,"slotId":3,"occurredAt":"2026-03-02T00:00:00Z"}
                """);

        verify(admissionService).promoteNext(3L);
        assertThat(meterRegistry.counter("admission.booking_released.processed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("깨진 JSON / 필수 필드 누락은 건너뛴다")
    void onMessage_invalid_skipped() {
        consumer.onMessage("not-json");
        consumer.onMessage("""
                {"eventId":"ev-2","bookingId":55}
                """);

        verify(admissionService, never()).promoteNext(anyLong());
        assertThat(meterRegistry.counter("admission.booking_released.skip", "reason", "invalid_payload").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("admission.booking_released.skip", "reason", "invalid_fields").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("락 대기 초과(재시도 가능)는 다시 던져 컨테이너 재시도에 맡긴다")
    void onMessage_retryable_rethrown() {
        given(admissionService.promoteNext(3L)).willThrow(new BusinessException(ErrorCode.SLOT_BUSY));

        assertThatThrownBy(() -> consumer.onMessage("""
                {"eventId":"ev-3","slotId":3}
                """)).isInstanceOf(BusinessException.class);
        assertThat(meterRegistry.counter("admission.booking_released.retryable_error").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("재시도 불가 비즈니스 오류는 기록 후 건너뛴다")
    void onMessage_nonRetryable_skipped() {
        given(admissionService.promoteNext(3L)).willThrow(new BusinessException(ErrorCode.SLOT_NOT_FOUND));

        consumer.onMessage("""
                {"eventId":"ev-4","slotId":3}
                """);

        assertThat(meterRegistry.counter("admission.booking_released.skip", "reason", "business_exception").count()).isEqualTo(1.0);
    }
}
