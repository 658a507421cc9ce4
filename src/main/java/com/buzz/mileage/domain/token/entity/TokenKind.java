package com.buzz.mileage.domain.token.entity;

/**
 * QR 토큰 종류
 */
public enum TokenKind {
    MILEAGE,
    COUPON
}
