package com.buzz.mileage.domain.token.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 발급된 QR 토큰
 *
 * ISSUED → CONSUMED 또는 ISSUED → EXPIRED. 종료 상태에서는 다시 전이하지 않는다.
 * consumed 변경은 RedemptionTokenRepository.consume (조건부 UPDATE) 로만 한다.
 * tokenId 는 서명 페이로드에 포함되어야 하므로 발급 시점에 직접 부여한다.
 */
@Entity
@Table(name = "qr_tokens",
        uniqueConstraints = @UniqueConstraint(name = "uk_qr_tokens_hash", columnNames = "token_hash"),
        indexes = {
                @Index(name = "idx_qr_tokens_account", columnList = "account_id"),
                @Index(name = "idx_qr_tokens_expiry", columnList = "consumed, expires_at")
        })
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class RedemptionToken {

    @Id
    @Column(name = "id", length = 36)
    private String tokenId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private TokenKind kind;

    @Column(name = "reference_id", updatable = false)
    private String referenceId;     // COUPON 토큰의 쿠폰 ID

    @Column(name = "token_hash", nullable = false, updatable = false, length = 64)
    private String tokenHash;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private LocalDateTime issuedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private LocalDateTime expiresAt;

    @Column(nullable = false)
    private boolean consumed;

    @Column(name = "consumed_by")
    private String consumedBy;      // 가맹점 ID

    @Column(name = "consumed_at")
    private LocalDateTime consumedAt;

    /**
     * 만료 여부. expiresAt 이후부터 만료로 본다 (expiresAt 시각 자체는 유효).
     */
    public boolean isExpiredAt(LocalDateTime now) {
        return now.isAfter(expiresAt);
    }

    public TokenStatus statusAt(LocalDateTime now) {
        if (isExpiredAt(now)) {
            return consumed ? TokenStatus.CONSUMED : TokenStatus.EXPIRED;
        }
        return consumed ? TokenStatus.CONSUMED : TokenStatus.ISSUED;
    }

    public boolean matchesHash(String hash) {
        return tokenHash.equals(hash);
    }
}
