package com.buzz.mileage.domain.common.exception;

/**
 * 도메인 예외의 최상위 추상 클래스
 * 모든 도메인 예외는 이 클래스를 상속받고 ErrorCode 로 분류된다
 */
public abstract class BusinessException extends RuntimeException {
    private final ErrorCode errorCode;

    protected BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    protected BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getCode() {
        return errorCode.getCode();
    }

    public ErrorCategory getCategory() {
        return errorCode.getCategory();
    }
}
