package com.buzz.mileage.application.settlement.usecase;

import com.buzz.mileage.application.settlement.dto.SettlementResponse;
import com.buzz.mileage.application.settlement.service.SettlementTransitionService;
import com.buzz.mileage.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 정산 승인 유스케이스
 * 승인이 실제로 일어난 경우에만 가맹점 알림 이벤트가 적재된다
 */
@Service
@RequiredArgsConstructor
public class ApproveSettlementUseCase {

    private final SettlementTransitionService settlementTransitionService;

    @Trace
    public SettlementResponse execute(String settlementId, String approverId) {
        return SettlementResponse.from(settlementTransitionService.approve(settlementId, approverId));
    }
}
