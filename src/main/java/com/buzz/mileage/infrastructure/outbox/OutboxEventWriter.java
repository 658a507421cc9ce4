package com.buzz.mileage.infrastructure.outbox;

import com.buzz.mileage.infrastructure.outbox.entity.OutboxEvent;
import com.buzz.mileage.infrastructure.outbox.repository.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 비즈니스 트랜잭션 안에서 Outbox 에 이벤트를 적재
 * 알림 전달 결과는 기다리지 않는다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventWriter {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent append(OutboxEventType eventType, String aggregateId, Object message) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Outbox 이벤트 직렬화 실패 - eventType={}, aggregateId={}", eventType, aggregateId, e);
            throw new IllegalStateException("Outbox 이벤트 직렬화 실패", e);
        }

        OutboxEvent saved = outboxEventRepository.save(
                OutboxEvent.pending(eventType, aggregateId, payload, LocalDateTime.now(clock)));

        log.info("Outbox 이벤트 저장 - eventType={}, aggregateId={}, eventId={}",
                eventType, aggregateId, saved.getId());
        return saved;
    }
}
