package com.buzz.mileage.domain.coupon.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;

/**
 * 이미 사용된 쿠폰
 */
public class CouponAlreadyUsedException extends BusinessException {

    public CouponAlreadyUsedException(String couponId) {
        super(ErrorCode.C004, String.format("이미 사용된 쿠폰입니다. couponId: %s", couponId));
    }
}
