package com.buzz.mileage.domain.coupon.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;

public class CouponExpiredException extends BusinessException {

    public CouponExpiredException(String couponId) {
        super(ErrorCode.C003, String.format("만료된 쿠폰입니다. couponId: %s", couponId));
    }
}
