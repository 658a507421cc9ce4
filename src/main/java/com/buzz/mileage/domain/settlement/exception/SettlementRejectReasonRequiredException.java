package com.buzz.mileage.domain.settlement.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;

public class SettlementRejectReasonRequiredException extends BusinessException {

    public SettlementRejectReasonRequiredException() {
        super(ErrorCode.S003);
    }
}
