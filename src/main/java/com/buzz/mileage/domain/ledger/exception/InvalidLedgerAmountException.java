package com.buzz.mileage.domain.ledger.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;

public class InvalidLedgerAmountException extends BusinessException {

    public InvalidLedgerAmountException(long amount) {
        super(ErrorCode.M002, String.format("유효하지 않은 마일리지 금액입니다: %d", amount));
    }
}
