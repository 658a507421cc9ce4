package com.buzz.mileage.domain.token.vo;

import com.buzz.mileage.domain.account.entity.Account;
import com.buzz.mileage.domain.coupon.entity.Coupon;
import com.buzz.mileage.domain.token.entity.RedemptionToken;

/**
 * 토큰 검증 결과
 * 성공 시 토큰에 묶인 계정/쿠폰 정보를 함께 돌려준다
 */
public record TokenVerification(
        boolean valid,
        VerificationFailure failure,
        RedemptionToken token,
        Account account,
        Coupon coupon
) {

    public static TokenVerification success(RedemptionToken token, Account account, Coupon coupon) {
        return new TokenVerification(true, null, token, account, coupon);
    }

    public static TokenVerification fail(VerificationFailure failure) {
        return new TokenVerification(false, failure, null, null, null);
    }

    public static TokenVerification fail(VerificationFailure failure, RedemptionToken token) {
        return new TokenVerification(false, failure, token, null, null);
    }
}
