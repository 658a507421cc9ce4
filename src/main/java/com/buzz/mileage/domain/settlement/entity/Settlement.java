package com.buzz.mileage.domain.settlement.entity;

import com.buzz.mileage.domain.settlement.exception.InvalidSettlementTransitionException;
import com.buzz.mileage.domain.settlement.exception.SettlementRejectReasonRequiredException;
import com.buzz.mileage.domain.settlement.vo.SettlementAmount;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 가맹점 정산 요청
 *
 * QR 사용 1건당 정확히 1건 생성된다 (reference_type + reference_id 유니크).
 * 상태 전이는 멱등이다. 이미 도달한 상태로의 재요청은 아무 것도 바꾸지 않고 false 를 반환한다.
 */
@Entity
@Table(name = "settlements",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_settlements_reference", columnNames = {"reference_type", "reference_id"}),
                @UniqueConstraint(name = "uk_settlements_coupon", columnNames = "coupon_id")
        },
        indexes = @Index(name = "idx_settlements_merchant_status", columnList = "merchant_id, status"))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Settlement {

    public static final String REFERENCE_QR_TOKEN = "QR_TOKEN";

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String settlementId;

    @Column(name = "merchant_id", nullable = false, updatable = false)
    private String merchantId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private String accountId;

    @Column(name = "coupon_id", updatable = false)
    private String couponId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private SettlementKind kind;

    @Column(name = "gross_amount", nullable = false, updatable = false)
    private long grossAmount;

    @Column(name = "subsidy_amount", nullable = false, updatable = false)
    private long subsidyAmount;

    @Column(name = "net_amount", nullable = false, updatable = false)
    private long netAmount;

    @Column(name = "reference_type", nullable = false, updatable = false, length = 20)
    private String referenceType;

    @Column(name = "reference_id", nullable = false, updatable = false)
    private String referenceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SettlementStatus status;

    @Column(name = "requested_at", nullable = false, updatable = false)
    private LocalDateTime requestedAt;

    @Column(name = "approved_at")
    private LocalDateTime approvedAt;

    @Column(name = "approved_by")
    private String approvedBy;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "rejected_at")
    private LocalDateTime rejectedAt;

    @Column(name = "rejection_reason")
    private String rejectionReason;

    @Version
    private Long version;

    public static Settlement request(String merchantId, String accountId, String couponId, String tokenId,
                                     SettlementAmount amount, LocalDateTime now) {
        return Settlement.builder()
                .merchantId(merchantId)
                .accountId(accountId)
                .couponId(couponId)
                .kind(amount.kind())
                .grossAmount(amount.gross())
                .subsidyAmount(amount.subsidy())
                .netAmount(amount.net())
                .referenceType(REFERENCE_QR_TOKEN)
                .referenceId(tokenId)
                .status(SettlementStatus.REQUESTED)
                .requestedAt(now)
                .build();
    }

    /**
     * 승인
     * @return 실제로 상태가 바뀌었으면 true (이미 승인/지급된 경우 false)
     */
    public boolean approve(String approverId, LocalDateTime now) {
        switch (status) {
            case REQUESTED -> {
                this.status = SettlementStatus.APPROVED;
                this.approvedBy = approverId;
                this.approvedAt = now;
                return true;
            }
            case APPROVED, PAID -> {
                return false;
            }
            default -> throw new InvalidSettlementTransitionException(settlementId, status, SettlementStatus.APPROVED);
        }
    }

    /**
     * 지급 완료. 승인된 정산만 가능하다.
     */
    public boolean markPaid(LocalDateTime now) {
        switch (status) {
            case APPROVED -> {
                this.status = SettlementStatus.PAID;
                this.paidAt = now;
                return true;
            }
            case PAID -> {
                return false;
            }
            default -> throw new InvalidSettlementTransitionException(settlementId, status, SettlementStatus.PAID);
        }
    }

    /**
     * 반려. 요청 상태에서만 가능하며 사유가 필요하다.
     */
    public boolean reject(String reason, LocalDateTime now) {
        if (reason == null || reason.isBlank()) {
            throw new SettlementRejectReasonRequiredException();
        }
        switch (status) {
            case REQUESTED -> {
                this.status = SettlementStatus.REJECTED;
                this.rejectionReason = reason;
                this.rejectedAt = now;
                return true;
            }
            case REJECTED -> {
                return false;
            }
            default -> throw new InvalidSettlementTransitionException(settlementId, status, SettlementStatus.REJECTED);
        }
    }
}
