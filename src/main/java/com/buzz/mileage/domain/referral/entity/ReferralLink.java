package com.buzz.mileage.domain.referral.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 완료된 추천 기록
 * 피추천인은 한 번만 추천받을 수 있다 (referee_id 유니크)
 */
@Entity
@Table(name = "referrals",
        uniqueConstraints = @UniqueConstraint(name = "uk_referrals_referee", columnNames = "referee_id"),
        indexes = @Index(name = "idx_referrals_referrer_created", columnList = "referrer_id, created_at"))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class ReferralLink {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String referralId;

    @Column(name = "referrer_id", nullable = false, updatable = false)
    private String referrerId;

    @Column(name = "referee_id", nullable = false, updatable = false)
    private String refereeId;

    @Column(name = "referral_code", nullable = false, updatable = false, length = 32)
    private String referralCode;

    /**
     * 추천인에게 지급된 총액 (기본 보상 + 이벤트 차액)
     */
    @Column(name = "reward_amount", nullable = false)
    private long rewardAmount;

    /**
     * 피추천인에게 지급된 총액 (추천 가입 보너스 + 이벤트 차액)
     */
    @Column(name = "signup_bonus", nullable = false)
    private long signupBonus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReferralStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (status == null) {
            status = ReferralStatus.COMPLETED;
        }
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
