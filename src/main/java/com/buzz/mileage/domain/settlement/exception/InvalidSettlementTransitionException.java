package com.buzz.mileage.domain.settlement.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;
import com.buzz.mileage.domain.settlement.entity.SettlementStatus;

/**
 * 순서에 맞지 않는 정산 상태 전이 (예: 승인 전 지급)
 */
public class InvalidSettlementTransitionException extends BusinessException {

    public InvalidSettlementTransitionException(String settlementId, SettlementStatus from, SettlementStatus to) {
        super(ErrorCode.S002,
              String.format("허용되지 않은 정산 상태 변경입니다. settlementId: %s, %s → %s", settlementId, from, to));
    }
}
