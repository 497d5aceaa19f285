package com.len.admission.domain.waitlist;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(
        name = "waitlist_entry",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uk_waitlist_student_slot",
                        columnNames = {"student_id", "slot_id"}
                )
        },
        indexes = {
                @Index(name = "ix_waitlist_slot_priority", columnList = "slot_id, priority"),
                @Index(name = "ix_waitlist_expires_at", columnList = "expires_at")
        }
)
public class WaitlistEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Column(name = "slot_id", nullable = false)
    private Long slotId;

    // 1 = 다음 차례
    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    public static WaitlistEntry newEntry(Long studentId, Long slotId, int priority,
                                         LocalDateTime now, Duration ttl) {
        WaitlistEntry e = new WaitlistEntry();
        e.studentId = studentId;
        e.slotId = slotId;
        e.priority = priority;
        e.createdAt = now;
        e.expiresAt = now.plus(ttl);
        return e;
    }

    /**
     * expiresAt == now 도 만료로 본다.
     */
    public boolean isExpired(LocalDateTime now) {
        return !expiresAt.isAfter(now);
    }

    public void reprioritize(int priority) {
        if (priority < 1) {
            throw new IllegalArgumentException("priority must be >= 1: " + priority);
        }
        this.priority = priority;
    }
}
