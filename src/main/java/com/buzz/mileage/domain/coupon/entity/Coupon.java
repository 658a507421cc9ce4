package com.buzz.mileage.domain.coupon.entity;

import com.buzz.mileage.domain.coupon.exception.InvalidCouponException;
import com.buzz.mileage.infrastructure.jpa.BaseEntity;
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
 * 회원 보유 쿠폰
 * used = true 는 종료 상태이며, 사용 처리는 CouponRepository.markUsed (조건부 UPDATE) 로만 한다
 */
@Entity
@Table(name = "coupons", indexes = {
        @Index(name = "idx_coupons_owner", columnList = "owner_account_id, used")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Coupon extends BaseEntity {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String couponId;

    @Column(name = "owner_account_id", nullable = false)
    private String ownerAccountId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CouponKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "discount_mode", nullable = false, length = 20)
    private DiscountMode discountMode;

    @Column(name = "discount_value", nullable = false)
    private long discountValue;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;    // null 이면 무기한

    @Column(nullable = false)
    private boolean used;

    @Column(name = "used_by_merchant_id")
    private String usedByMerchantId;

    @Column(name = "used_at")
    private LocalDateTime usedAt;

    public static Coupon grant(String ownerAccountId, String name, CouponKind kind,
                               DiscountMode discountMode, long discountValue, LocalDateTime expiresAt) {
        if (discountValue <= 0) {
            throw new InvalidCouponException("할인 값은 0보다 커야 합니다");
        }
        if (discountMode == DiscountMode.PERCENTAGE && discountValue > 100) {
            throw new InvalidCouponException("할인율은 100%를 넘을 수 없습니다");
        }
        return Coupon.builder()
                .ownerAccountId(ownerAccountId)
                .name(name)
                .kind(kind)
                .discountMode(discountMode)
                .discountValue(discountValue)
                .expiresAt(expiresAt)
                .used(false)
                .build();
    }

    /**
     * 할인 금액 계산
     * 정률 쿠폰은 floor(orderAmount * pct / 100) 이며 결과가 1원 이상이어야 한다
     * @throws InvalidCouponException 주문 금액 누락, 곱셈 범위 초과, 할인 금액 0원
     */
    public long calculateDiscount(Long orderAmount) {
        if (discountMode == DiscountMode.AMOUNT) {
            return discountValue;
        }
        if (orderAmount == null || orderAmount <= 0) {
            throw new InvalidCouponException("정률 쿠폰은 0보다 큰 주문 금액이 필요합니다");
        }
        if (orderAmount > Long.MAX_VALUE / discountValue) {
            throw new InvalidCouponException("주문 금액이 너무 큽니다. orderAmount: " + orderAmount);
        }
        long discount = orderAmount * discountValue / 100;
        if (discount <= 0) {
            throw new InvalidCouponException("할인 금액이 0원이 되는 주문 금액입니다. orderAmount: " + orderAmount);
        }
        return discount;
    }

    public boolean isOwnedBy(String accountId) {
        return ownerAccountId.equals(accountId);
    }

    public boolean isExpiredAt(LocalDateTime now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public boolean isUsableAt(LocalDateTime now) {
        return !used && !isExpiredAt(now);
    }
}
