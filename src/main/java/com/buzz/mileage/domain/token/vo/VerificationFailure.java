package com.buzz.mileage.domain.token.vo;

/**
 * 토큰 검증 실패 사유
 * 검증 실패는 예외가 아니라 사유 코드로 전달한다 (가맹점 화면 흐름을 끊지 않기 위함)
 */
public enum VerificationFailure {
    MALFORMED("malformed"),
    INVALID_SIGNATURE("invalid_signature"),
    NOT_FOUND("not_found"),
    EXPIRED("expired"),
    ALREADY_USED("already_used"),
    INACTIVE_ACCOUNT("inactive_account"),
    COUPON_UNAVAILABLE("coupon_unavailable");

    private final String reasonCode;

    VerificationFailure(String reasonCode) {
        this.reasonCode = reasonCode;
    }

    public String reasonCode() {
        return reasonCode;
    }
}
