package com.buzz.mileage.infrastructure.outbox.publisher;

import com.buzz.mileage.infrastructure.outbox.EventStatus;
import com.buzz.mileage.infrastructure.outbox.entity.OutboxEvent;
import com.buzz.mileage.infrastructure.outbox.repository.OutboxEventRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Outbox 이벤트를 Kafka 로 발행하는 스케줄러
 *
 * 발행 결과를 동기로 확인한 뒤 PUBLISHED 로 표시한다. 실패 시 Exponential Backoff 로 재시도.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventPublisher {

    private static final int MAX_RETRY_COUNT = 5;
    private static final int BATCH_SIZE = 100;
    private static final long SEND_TIMEOUT_SECONDS = 5L;
    private static final int RETENTION_DAYS = 30;

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${buzz.outbox.publish-interval-ms:5000}")
    @Transactional
    public void publishPendingEvents() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<OutboxEvent> dueEvents = outboxEventRepository.findDueEvents(
                EventStatus.PENDING, now, PageRequest.of(0, BATCH_SIZE));

        if (dueEvents.isEmpty()) {
            return;
        }

        log.info("Outbox 이벤트 발행 시작 - 대상: {}건", dueEvents.size());

        int successCount = 0;
        int failCount = 0;

        for (OutboxEvent event : dueEvents) {
            try {
                send(event);
                event.markAsPublished(LocalDateTime.now(clock));
                successCount++;
                log.debug("이벤트 발행 성공 - eventId={}, aggregateId={}, eventType={}",
                        event.getId(), event.getAggregateId(), event.getEventType());
            } catch (OutboxPublishException e) {
                event.recordFailure(e.getMessage(), MAX_RETRY_COUNT, LocalDateTime.now(clock));
                failCount++;
                if (event.getStatus() == EventStatus.FAILED) {
                    log.error("이벤트 발행 최종 실패 - eventId={}, aggregateId={}, retryCount={}",
                            event.getId(), event.getAggregateId(), event.getRetryCount(), e);
                } else {
                    log.warn("이벤트 발행 실패 - eventId={}, retryCount={}, error={}",
                            event.getId(), event.getRetryCount(), e.getMessage());
                }
            }
        }

        log.info("Outbox 이벤트 발행 완료 - 성공: {}건, 실패: {}건", successCount, failCount);
    }

    /**
     * 매일 자정, 보관 기간이 지난 PUBLISHED 이벤트 삭제
     */
    @Scheduled(cron = "0 0 0 * * *")
    @Transactional
    public void cleanupOldPublishedEvents() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(RETENTION_DAYS);
        int deleted = outboxEventRepository.deletePublishedBefore(EventStatus.PUBLISHED, cutoff);
        log.info("오래된 Outbox 이벤트 정리 완료 - cutoff={}, deleted={}", cutoff, deleted);
    }

    private void send(OutboxEvent event) {
        try {
            kafkaTemplate.send(event.topic(), event.getAggregateId(), event.getPayload())
                    .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OutboxPublishException("Kafka 발행 중단", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new OutboxPublishException("Kafka 발행 실패: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new OutboxPublishException("Kafka 발행 실패: " + e.getMessage(), e);
        }
    }

    static class OutboxPublishException extends RuntimeException {
        OutboxPublishException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
