package com.len.admission.domain.slot;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 슬롯 원본은 외부(지점/강사 관리) 소유. 여기서는 정원과 시간만 읽는다.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(name = "slot")
public class Slot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private int capacity;

    @Column(name = "start_at", nullable = false)
    private LocalDateTime startAt;

    @Column(name = "end_at", nullable = false)
    private LocalDateTime endAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    private Slot(int capacity, LocalDateTime startAt, LocalDateTime endAt, LocalDateTime now) {
        this.capacity = capacity;
        this.startAt = startAt;
        this.endAt = endAt;
        this.createdAt = now;
    }

    public static Slot create(int capacity, LocalDateTime startAt, LocalDateTime endAt, LocalDateTime now) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        return new Slot(capacity, startAt, endAt, now);
    }

    public SlotInfo toInfo() {
        return new SlotInfo(id, capacity, startAt, endAt);
    }
}
