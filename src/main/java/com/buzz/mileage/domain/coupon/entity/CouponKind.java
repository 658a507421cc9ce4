package com.buzz.mileage.domain.coupon.entity;

/**
 * 쿠폰 종류
 * EVENT 쿠폰은 할인액 일부를 정부 지원금으로 정산한다
 */
public enum CouponKind {
    BASIC,
    EVENT
}
