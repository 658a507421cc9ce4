package com.buzz.mileage.domain.coupon.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;

/**
 * 유효하지 않은 쿠폰 (소유자 불일치, 할인 조건 오류 등)
 */
public class InvalidCouponException extends BusinessException {

    public InvalidCouponException(String message) {
        super(ErrorCode.C002, message);
    }
}
