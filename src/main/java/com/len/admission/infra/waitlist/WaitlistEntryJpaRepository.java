package com.len.admission.infra.waitlist;

import com.len.admission.domain.waitlist.WaitlistEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface WaitlistEntryJpaRepository extends JpaRepository<WaitlistEntry, Long> {

    @Query("""
        select w from WaitlistEntry w
        where w.slotId = :slotId
          and w.expiresAt > :now
        order by w.priority asc, w.createdAt asc, w.id asc
    """)
    List<WaitlistEntry> findActiveBySlot(@Param("slotId") Long slotId,
                                         @Param("now") LocalDateTime now);

    @Query("""
        select w from WaitlistEntry w
        where w.studentId = :studentId
          and w.expiresAt > :now
        order by w.createdAt desc, w.id desc
    """)
    List<WaitlistEntry> findActiveByStudent(@Param("studentId") Long studentId,
                                            @Param("now") LocalDateTime now);

    Optional<WaitlistEntry> findByStudentIdAndSlotId(Long studentId, Long slotId);

    @Query("""
        select w from WaitlistEntry w
        where w.slotId = :slotId
          and w.expiresAt <= :now
        order by w.priority asc, w.id asc
    """)
    List<WaitlistEntry> findExpiredBySlot(@Param("slotId") Long slotId,
                                          @Param("now") LocalDateTime now);

    // 만료 스윕 대상 슬롯만 먼저 뽑고, 실제 삭제는 슬롯 락 안에서 다시 조회한다
    @Query("""
        select distinct w.slotId from WaitlistEntry w
        where w.expiresAt <= :now
          and w.slotId > :afterSlotId
        order by w.slotId asc
    """)
    List<Long> findSlotIdsWithExpired(@Param("now") LocalDateTime now,
                                      @Param("afterSlotId") Long afterSlotId,
                                      Pageable pageable);
}
