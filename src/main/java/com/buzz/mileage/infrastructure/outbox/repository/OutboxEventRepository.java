package com.buzz.mileage.infrastructure.outbox.repository;

import com.buzz.mileage.infrastructure.outbox.EventStatus;
import com.buzz.mileage.infrastructure.outbox.OutboxEventType;
import com.buzz.mileage.infrastructure.outbox.entity.OutboxEvent;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Outbox 이벤트 Repository
 */
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    /**
     * 재시도 시각이 된 PENDING 이벤트 (생성 순)
     */
    @Query("SELECT e FROM OutboxEvent e WHERE e.status = :status AND e.nextRetryAt <= :now ORDER BY e.createdAt ASC")
    List<OutboxEvent> findDueEvents(@Param("status") EventStatus status,
                                    @Param("now") LocalDateTime now,
                                    Pageable pageable);

    List<OutboxEvent> findByEventTypeAndAggregateId(OutboxEventType eventType, String aggregateId);

    @Modifying
    @Query("DELETE FROM OutboxEvent e WHERE e.status = :status AND e.publishedAt < :cutoff")
    int deletePublishedBefore(@Param("status") EventStatus status, @Param("cutoff") LocalDateTime cutoff);
}
