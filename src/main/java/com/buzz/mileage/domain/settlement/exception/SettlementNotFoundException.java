package com.buzz.mileage.domain.settlement.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;

public class SettlementNotFoundException extends BusinessException {

    public SettlementNotFoundException(String settlementId) {
        super(ErrorCode.S001, String.format("정산 내역을 찾을 수 없습니다. settlementId: %s", settlementId));
    }
}
