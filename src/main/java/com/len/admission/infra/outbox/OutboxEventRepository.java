package com.len.admission.infra.outbox;

import com.len.admission.domain.outbox.OutboxEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface OutboxEventRepository extends JpaRepository<OutboxEvent, String> {

    // 여러 인스턴스가 동시에 돌아도 같은 이벤트를 잡지 않게 SKIP LOCKED (MySQL 8)
    @Query(value = """
        SELECT * FROM outbox_event
         WHERE status = 'PENDING'
           AND next_retry_at <= :now
         ORDER BY created_at
         LIMIT :limit
         FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEvent> lockPendingBatch(@Param("now") LocalDateTime now, @Param("limit") int limit);
}
