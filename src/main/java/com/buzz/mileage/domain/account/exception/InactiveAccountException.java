package com.buzz.mileage.domain.account.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;

public class InactiveAccountException extends BusinessException {

    public InactiveAccountException(String accountId) {
        super(ErrorCode.A004, String.format("비활성화된 계정입니다. accountId: %s", accountId));
    }
}
