package com.buzz.mileage.domain.account.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;

/**
 * 이메일 또는 전화번호가 이미 사용 중일 때 발생하는 예외
 */
public class DuplicateAccountException extends BusinessException {

    private DuplicateAccountException(ErrorCode errorCode) {
        super(errorCode);
    }

    public static DuplicateAccountException email() {
        return new DuplicateAccountException(ErrorCode.A002);
    }

    public static DuplicateAccountException phone() {
        return new DuplicateAccountException(ErrorCode.A003);
    }
}
