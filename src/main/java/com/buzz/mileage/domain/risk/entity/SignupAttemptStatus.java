package com.buzz.mileage.domain.risk.entity;

public enum SignupAttemptStatus {
    PENDING,
    SUCCESS,
    FAILED,
    BLOCKED
}
