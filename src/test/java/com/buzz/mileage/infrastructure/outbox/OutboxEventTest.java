package com.buzz.mileage.infrastructure.outbox;

import com.buzz.mileage.infrastructure.outbox.entity.OutboxEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * OutboxEvent 엔티티 단위 테스트
 */
@DisplayName("OutboxEvent 엔티티 테스트")
class OutboxEventTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 1, 12, 0);

    @Test
    @DisplayName("새 이벤트는 PENDING 상태이고 이벤트 종류에 맞는 집계 타입과 토픽을 가진다")
    void pending() {
        // when
        OutboxEvent event = OutboxEvent.pending(OutboxEventType.SETTLEMENT_APPROVED, "S-001", "{}", NOW);

        // then
        assertThat(event.getStatus()).isEqualTo(EventStatus.PENDING);
        assertThat(event.getAggregateType()).isEqualTo("SETTLEMENT");
        assertThat(event.topic()).isEqualTo("settlement-events");
        assertThat(event.getRetryCount()).isZero();
        assertThat(event.getNextRetryAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("발행 성공 시 PUBLISHED 상태로 변경되고 publishedAt이 설정된다")
    void markAsPublished() {
        // given
        OutboxEvent event = OutboxEvent.pending(OutboxEventType.REFERRAL_COMPLETED, "R-001", "{}", NOW);
        event.recordFailure("timeout", 5, NOW);

        // when
        event.markAsPublished(NOW.plusMinutes(1));

        // then
        assertThat(event.getStatus()).isEqualTo(EventStatus.PUBLISHED);
        assertThat(event.getPublishedAt()).isEqualTo(NOW.plusMinutes(1));
        assertThat(event.getErrorMessage()).isNull();
    }

    @Test
    @DisplayName("발행 실패 시 retryCount가 증가하고 nextRetryAt이 Exponential Backoff로 설정된다")
    void recordFailure_backoff() {
        // given
        OutboxEvent event = OutboxEvent.pending(OutboxEventType.REFERRAL_COMPLETED, "R-001", "{}", NOW);

        // when
        event.recordFailure("Connection timeout", 5, NOW);

        // then
        assertThat(event.getRetryCount()).isEqualTo(1);
        assertThat(event.getStatus()).isEqualTo(EventStatus.PENDING);
        assertThat(event.getErrorMessage()).isEqualTo("Connection timeout");
        assertThat(event.getNextRetryAt()).isEqualTo(NOW.plusSeconds(20));

        // when
        event.recordFailure("Connection timeout", 5, NOW);

        // then
        assertThat(event.getNextRetryAt()).isEqualTo(NOW.plusSeconds(40));
    }

    @Test
    @DisplayName("최대 재시도 횟수에 도달하면 FAILED 상태로 변경된다")
    void recordFailure_maxRetry() {
        // given
        OutboxEvent event = OutboxEvent.pending(OutboxEventType.REFERRAL_COMPLETED, "R-001", "{}", NOW);

        // when
        for (int i = 0; i < 5; i++) {
            event.recordFailure("broker down", 5, NOW);
        }

        // then
        assertThat(event.getRetryCount()).isEqualTo(5);
        assertThat(event.getStatus()).isEqualTo(EventStatus.FAILED);
    }
}
