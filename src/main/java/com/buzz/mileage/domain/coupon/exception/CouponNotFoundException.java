package com.buzz.mileage.domain.coupon.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;

public class CouponNotFoundException extends BusinessException {

    public CouponNotFoundException(String couponId) {
        super(ErrorCode.C001, String.format("쿠폰을 찾을 수 없습니다. couponId: %s", couponId));
    }
}
