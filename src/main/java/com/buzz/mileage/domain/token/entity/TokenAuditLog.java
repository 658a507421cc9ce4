package com.buzz.mileage.domain.token.entity;

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
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * QR 토큰 사용 이력 (append-only)
 * 토큰 행이 보관 정책으로 삭제된 뒤에도 남는다
 */
@Entity
@Immutable
@Table(name = "qr_usage_logs", indexes = {
        @Index(name = "idx_qr_usage_logs_token", columnList = "token_id"),
        @Index(name = "idx_qr_usage_logs_merchant", columnList = "merchant_id, created_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class TokenAuditLog {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "token_id", nullable = false)
    private String tokenId;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TokenAuditAction action;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TokenKind kind;

    @Column(name = "merchant_id")
    private String merchantId;

    @Column(name = "amount")
    private Long amount;

    @Column(name = "discount_amount")
    private Long discountAmount;

    @Column(name = "subsidy_amount")
    private Long subsidyAmount;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
