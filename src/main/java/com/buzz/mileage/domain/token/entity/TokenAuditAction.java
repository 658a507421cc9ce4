package com.buzz.mileage.domain.token.entity;

public enum TokenAuditAction {
    GENERATED,
    VERIFIED,
    USED,
    EXPIRED
}
