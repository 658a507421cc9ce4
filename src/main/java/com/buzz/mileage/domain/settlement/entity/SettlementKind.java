package com.buzz.mileage.domain.settlement.entity;

public enum SettlementKind {
    MILEAGE_USE,
    BASIC_COUPON,
    EVENT_COUPON
}
