package com.buzz.mileage.domain.referral.entity;

public enum ReferralStatus {
    COMPLETED
}
