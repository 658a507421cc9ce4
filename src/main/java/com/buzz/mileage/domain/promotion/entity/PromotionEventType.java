package com.buzz.mileage.domain.promotion.entity;

public enum PromotionEventType {
    SIGNUP_BONUS,
    REFERRAL_BONUS,
    SPECIAL_COUPON
}
