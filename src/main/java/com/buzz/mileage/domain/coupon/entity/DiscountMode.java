package com.buzz.mileage.domain.coupon.entity;

public enum DiscountMode {
    /**
     * 정액 할인
     */
    AMOUNT,

    /**
     * 정률 할인 (주문 금액 필요)
     */
    PERCENTAGE
}
