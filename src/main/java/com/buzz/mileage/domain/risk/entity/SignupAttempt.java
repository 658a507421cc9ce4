package com.buzz.mileage.domain.risk.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 가입 시도 감사 기록
 * 위험도 점수와 기여 요인을 남긴다. 가입 흐름은 자신이 만든 시도의 결과만 갱신한다.
 */
@Entity
@Table(name = "signup_attempts", indexes = {
        @Index(name = "idx_signup_attempts_ip", columnList = "ip_address, attempted_at"),
        @Index(name = "idx_signup_attempts_email", columnList = "email")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class SignupAttempt {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String attemptId;

    @Column(nullable = false)
    private String email;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "device_fingerprint", length = 64)
    private String deviceFingerprint;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    @Column(name = "referral_code", length = 32)
    private String referralCode;

    @Column(name = "referrer_id")
    private String referrerId;

    @Column(name = "account_id")
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SignupAttemptStatus status;

    @Column(name = "risk_score", nullable = false)
    private int riskScore;

    @Column(name = "risk_factors", columnDefinition = "TEXT")
    private String riskFactors;     // JSON

    @Column(nullable = false)
    private boolean flagged;

    @Column(name = "result_reason")
    private String resultReason;

    @Column(name = "attempted_at", nullable = false)
    private LocalDateTime attemptedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public void markSuccess(String accountId, String referrerId, LocalDateTime now) {
        this.status = SignupAttemptStatus.SUCCESS;
        this.accountId = accountId;
        this.referrerId = referrerId;
        this.completedAt = now;
    }

    public void markFailed(String reason, LocalDateTime now) {
        this.status = SignupAttemptStatus.FAILED;
        this.resultReason = truncate(reason);
        this.completedAt = now;
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= 255) {
            return reason;
        }
        return reason.substring(0, 255);
    }
}
