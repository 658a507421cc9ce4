package com.buzz.mileage.application.settlement.usecase;

import com.buzz.mileage.application.settlement.dto.SettlementResponse;
import com.buzz.mileage.application.settlement.service.SettlementTransitionService;
import com.buzz.mileage.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 정산 지급 완료 처리 유스케이스
 */
@Service
@RequiredArgsConstructor
public class PaySettlementUseCase {

    private final SettlementTransitionService settlementTransitionService;

    @Trace
    public SettlementResponse execute(String settlementId) {
        return SettlementResponse.from(settlementTransitionService.markPaid(settlementId));
    }
}
