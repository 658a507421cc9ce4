package com.buzz.mileage.domain.token.entity;

/**
 * 저장된 상태(consumed) 와 만료 시각으로부터 계산되는 토큰 상태
 */
public enum TokenStatus {
    ISSUED,
    CONSUMED,
    EXPIRED
}
