package com.buzz.mileage.application.settlement.service;

import com.buzz.mileage.domain.settlement.entity.Settlement;
import com.buzz.mileage.domain.settlement.exception.SettlementNotFoundException;
import com.buzz.mileage.domain.settlement.repository.SettlementRepository;
import com.buzz.mileage.infrastructure.kafka.notification.message.SettlementApprovedMessage;
import com.buzz.mileage.infrastructure.outbox.OutboxEventType;
import com.buzz.mileage.infrastructure.outbox.OutboxEventWriter;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 정산 상태 전이 처리 서비스
 *
 * REQUESTED → APPROVED → PAID, REQUESTED → REJECTED
 * 이미 일어난 전이를 다시 요청하면 아무것도 바꾸지 않고 현재 상태를 돌려준다 (재시도 안전).
 * 동시 전이는 @Version 낙관적 락으로 한 건만 반영된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementTransitionService {

    private final SettlementRepository settlementRepository;
    private final OutboxEventWriter outboxEventWriter;
    private final Clock clock;

    @Transactional
    public Settlement approve(String settlementId, String approverId) {
        Settlement settlement = find(settlementId);

        boolean changed = settlement.approve(approverId, LocalDateTime.now(clock));
        if (changed) {
            settlementRepository.saveAndFlush(settlement);
            outboxEventWriter.append(OutboxEventType.SETTLEMENT_APPROVED, settlementId,
                    SettlementApprovedMessage.from(settlement));
            log.info("정산 승인 - settlementId={}, approverId={}", settlementId, approverId);
        } else {
            log.info("정산 승인 재요청 무시 - settlementId={}, status={}", settlementId, settlement.getStatus());
        }
        return settlement;
    }

    @Transactional
    public Settlement reject(String settlementId, String reason) {
        Settlement settlement = find(settlementId);

        if (settlement.reject(reason, LocalDateTime.now(clock))) {
            settlementRepository.saveAndFlush(settlement);
            log.info("정산 반려 - settlementId={}, reason={}", settlementId, reason);
        }
        return settlement;
    }

    @Transactional
    public Settlement markPaid(String settlementId) {
        Settlement settlement = find(settlementId);

        if (settlement.markPaid(LocalDateTime.now(clock))) {
            settlementRepository.saveAndFlush(settlement);
            log.info("정산 지급 완료 - settlementId={}, net={}", settlementId, settlement.getNetAmount());
        }
        return settlement;
    }

    private Settlement find(String settlementId) {
        return settlementRepository.findById(settlementId)
                .orElseThrow(() -> new SettlementNotFoundException(settlementId));
    }
}
