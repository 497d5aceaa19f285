package com.len.admission.domain.booking;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(
        name = "booking",
        indexes = {
                @Index(name = "ix_booking_slot_status", columnList = "slot_id, status"),
                @Index(name = "ix_booking_student_slot", columnList = "student_id, slot_id")
        }
)
public class Booking {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Column(name = "slot_id", nullable = false)
    private Long slotId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Booking create(Long studentId, Long slotId, BookingStatus status, LocalDateTime now) {
        Booking b = new Booking();
        b.studentId = studentId;
        b.slotId = slotId;
        b.status = status;
        b.createdAt = now;
        b.updatedAt = now;
        return b;
    }

    /**
     * CONFIRMED 에서만 CANCELLED / NO_SHOW 로 내려갈 수 있다.
     */
    public void release(BookingStatus target, LocalDateTime now) {
        if (target != BookingStatus.CANCELLED && target != BookingStatus.NO_SHOW) {
            throw new IllegalArgumentException("release target must be CANCELLED or NO_SHOW: " + target);
        }
        if (this.status != BookingStatus.CONFIRMED) {
            throw new IllegalStateException("booking " + id + " is " + status);
        }
        this.status = target;
        this.updatedAt = now;
    }

    public boolean occupiesSeat() {
        return status.occupiesSeat();
    }
}
