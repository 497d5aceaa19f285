package com.len.admission;

import com.len.admission.application.admission.AdmissionResult;
import com.len.admission.application.admission.AdmissionService;
import com.len.admission.application.booking.BookingReleaseService;
import com.len.admission.application.waitlist.WaitlistPosition;
import com.len.admission.domain.booking.Booking;
import com.len.admission.domain.booking.BookingStatus;
import com.len.admission.domain.slot.Slot;
import com.len.admission.infra.booking.BookingJpaRepository;
import com.len.admission.infra.booking.SlotJpaRepository;
import com.len.admission.infra.outbox.OutboxEventRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@ActiveProfiles("test")
class SlotAdmissionServiceApplicationTests {

    @Container
    @ServiceConnection
    static final MySQLContainer<?> mysql =
            new MySQLContainer<>("mysql:8.4")
                    .withDatabaseName("admission")
                    .withUsername("test")
                    .withPassword("test");

    @Autowired
    AdmissionService admissionService;

    @Autowired
    BookingReleaseService bookingReleaseService;

    @Autowired
    SlotJpaRepository slotRepository;

    @Autowired
    BookingJpaRepository bookingRepository;

    @Autowired
    OutboxEventRepository outboxEventRepository;

    @Test
    void contextLoads() {
    }

    @Test
    @DisplayName("만석 -> 대기 -> 취소 -> 1순위 승격, 알림은 outbox 에 적재")
    void admissionFlow() {
        long slotId = newSlot(1);
        long outboxBefore = outboxEventRepository.count();

        AdmissionResult first = admissionService.requestSeat(1001L, slotId);
        AdmissionResult second = admissionService.requestSeat(1002L, slotId);
        AdmissionResult third = admissionService.requestSeat(1003L, slotId);

        assertThat(first.isBooked()).isTrue();
        assertThat(second.waitlistPosition().priority()).isEqualTo(1);
        assertThat(third.waitlistPosition().priority()).isEqualTo(2);

        BookingReleaseService.ReleaseResult released = bookingReleaseService.cancel(first.booking().getId());

        assertThat(released.promoted().getStudentId()).isEqualTo(1002L);
        assertThat(admissionService.listForSlot(slotId))
                .extracting(WaitlistPosition::studentId, WaitlistPosition::priority)
                .containsExactly(tuple(1003L, 1));
        assertThat(bookingRepository.findBySlotId(slotId))
                .extracting(Booking::getStudentId, Booking::getStatus)
                .containsExactlyInAnyOrder(
                        tuple(1001L, BookingStatus.CANCELLED),
                        tuple(1002L, BookingStatus.CONFIRMED));
        // WAITLISTED 2건 + PROMOTED 1건
        assertThat(outboxEventRepository.count() - outboxBefore).isEqualTo(3);
    }

    @Test
    @DisplayName("대기 취소 후 같은 학생이 다시 대기하면 맨 뒤 순번")
    void withdrawAndRejoin() {
        long slotId = newSlot(1);
        admissionService.requestSeat(2001L, slotId);
        admissionService.requestSeat(2002L, slotId);
        admissionService.requestSeat(2003L, slotId);

        admissionService.withdraw(2002L, slotId);
        AdmissionResult rejoined = admissionService.requestSeat(2002L, slotId);

        assertThat(rejoined.waitlistPosition().priority()).isEqualTo(2);
        assertThat(admissionService.listForStudent(2003L)).singleElement()
                .extracting(WaitlistPosition::priority).isEqualTo(1);
    }

    @Test
    @DisplayName("MySQL 위에서도 동시 요청이 정원을 넘지 않는다")
    void concurrentRequests_respectCapacity() throws Exception {
        long slotId = newSlot(3);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Callable<AdmissionResult>> tasks = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            long studentId = 3000L + i;
            tasks.add(() -> admissionService.requestSeat(studentId, slotId));
        }

        int booked = 0;
        try {
            for (Future<AdmissionResult> f : pool.invokeAll(tasks)) {
                if (f.get().isBooked()) {
                    booked++;
                }
            }
        } finally {
            pool.shutdown();
        }

        assertThat(booked).isEqualTo(3);
        assertThat(bookingRepository.countBySlotIdAndStatusIn(slotId, BookingStatus.OCCUPYING)).isEqualTo(3);
        assertThat(admissionService.listForSlot(slotId)).extracting(WaitlistPosition::priority)
                .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9);
    }

    private long newSlot(int capacity) {
        LocalDateTime now = LocalDateTime.now();
        return slotRepository.save(Slot.create(capacity, now.plusDays(1), now.plusDays(1).plusHours(1), now)).getId();
    }
}
