package com.buzz.mileage.domain.common.exception;

/**
 * 에러 분류
 * 호출자가 "재시도하면 되는지", "경합에서 졌는지", "애초에 잘못된 요청인지" 구분할 수 있도록 한다
 */
public enum ErrorCategory {
    VALIDATION(false),
    NOT_FOUND(false),
    BUSINESS_RULE(false),
    FORBIDDEN(false),
    CONCURRENCY_CONFLICT(true),
    INFRASTRUCTURE(true);

    private final boolean retryable;

    ErrorCategory(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
