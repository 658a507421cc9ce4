package com.buzz.mileage.domain.account.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;

public class AccountNotFoundException extends BusinessException {

    public AccountNotFoundException(String accountId) {
        super(ErrorCode.A001, String.format("계정을 찾을 수 없습니다. accountId: %s", accountId));
    }
}
