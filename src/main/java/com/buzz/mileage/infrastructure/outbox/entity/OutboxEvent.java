package com.buzz.mileage.infrastructure.outbox.entity;

import com.buzz.mileage.infrastructure.outbox.EventStatus;
import com.buzz.mileage.infrastructure.outbox.OutboxEventType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Outbox 이벤트
 * 추천 완료/정산 승인 알림을 비즈니스 트랜잭션과 함께 커밋하고, 발행은 스케줄러가 따로 한다
 */
@Entity
@Table(name = "event_outbox", indexes = {
        @Index(name = "idx_outbox_status_retry", columnList = "status, next_retry_at"),
        @Index(name = "idx_outbox_aggregate", columnList = "aggregate_type, aggregate_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OutboxEvent {

    private static final long BASE_BACKOFF_SECONDS = 10L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "aggregate_type", nullable = false, length = 30)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false)
    private String aggregateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 40)
    private OutboxEventType eventType;

    @Column(name = "payload", columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private EventStatus status;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "retry_count", nullable = false)
    private Integer retryCount;

    @Column(name = "next_retry_at", nullable = false)
    private LocalDateTime nextRetryAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    public static OutboxEvent pending(OutboxEventType eventType, String aggregateId, String payload, LocalDateTime now) {
        return OutboxEvent.builder()
                .aggregateType(eventType.getAggregateType())
                .aggregateId(aggregateId)
                .eventType(eventType)
                .payload(payload)
                .status(EventStatus.PENDING)
                .retryCount(0)
                .createdAt(now)
                .nextRetryAt(now)
                .build();
    }

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (retryCount == null) {
            retryCount = 0;
        }
        if (status == null) {
            status = EventStatus.PENDING;
        }
        if (nextRetryAt == null) {
            nextRetryAt = now;
        }
    }

    public void markAsPublished(LocalDateTime now) {
        this.status = EventStatus.PUBLISHED;
        this.publishedAt = now;
        this.errorMessage = null;
    }

    /**
     * 발행 실패 기록
     * 재시도 간격은 10초 * 2^retryCount (20초, 40초, 80초 ...)
     * maxRetryCount 에 도달하면 FAILED 로 전환한다
     */
    public void recordFailure(String errorMessage, int maxRetryCount, LocalDateTime now) {
        this.retryCount++;
        this.errorMessage = errorMessage;
        this.nextRetryAt = now.plusSeconds(BASE_BACKOFF_SECONDS * (1L << Math.min(this.retryCount, 16)));

        if (this.retryCount >= maxRetryCount) {
            this.status = EventStatus.FAILED;
        }
    }

    public String topic() {
        return eventType.getTopic();
    }
}
