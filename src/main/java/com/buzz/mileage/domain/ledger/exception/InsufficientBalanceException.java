package com.buzz.mileage.domain.ledger.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;

/**
 * 마일리지 잔액이 부족할 때 발생하는 예외
 */
public class InsufficientBalanceException extends BusinessException {

    public InsufficientBalanceException(long required, long current) {
        super(ErrorCode.M001,
              String.format("마일리지 잔액이 부족합니다. 필요 금액: %d, 현재 잔액: %d", required, current));
    }
}
