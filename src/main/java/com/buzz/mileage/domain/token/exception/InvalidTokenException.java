package com.buzz.mileage.domain.token.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;
import com.buzz.mileage.domain.token.vo.VerificationFailure;

/**
 * 형식 오류 또는 서명 불일치 QR 페이로드
 */
public class InvalidTokenException extends BusinessException {

    private final VerificationFailure failure;

    public InvalidTokenException(VerificationFailure failure, String message) {
        super(ErrorCode.Q001, message);
        this.failure = failure;
    }

    public InvalidTokenException(VerificationFailure failure, String message, Throwable cause) {
        super(ErrorCode.Q001, message, cause);
        this.failure = failure;
    }

    public VerificationFailure getFailure() {
        return failure;
    }
}
