package com.buzz.mileage.domain.coupon.entity;

import com.buzz.mileage.domain.coupon.exception.InvalidCouponException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("쿠폰 엔티티 테스트")
class CouponTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 1, 12, 0);

    @Test
    @DisplayName("정액 쿠폰은 주문 금액과 무관하게 할인 값을 돌려준다")
    void 정액_할인() {
        Coupon coupon = Coupon.grant("A-001", "5천원 할인", CouponKind.BASIC, DiscountMode.AMOUNT, 5_000L, null);

        assertThat(coupon.calculateDiscount(null)).isEqualTo(5_000L);
    }

    @Test
    @DisplayName("정률 쿠폰은 주문 금액 기준으로 내림 계산한다")
    void 정률_할인() {
        Coupon coupon = Coupon.grant("A-001", "15% 할인", CouponKind.EVENT, DiscountMode.PERCENTAGE, 15L, null);

        assertThat(coupon.calculateDiscount(9_999L)).isEqualTo(1_499L);
    }

    @Test
    @DisplayName("정률 쿠폰은 주문 금액이 없으면 사용할 수 없다")
    void 정률_주문금액_필수() {
        Coupon coupon = Coupon.grant("A-001", "10% 할인", CouponKind.BASIC, DiscountMode.PERCENTAGE, 10L, null);

        assertThatThrownBy(() -> coupon.calculateDiscount(null))
                .isInstanceOf(InvalidCouponException.class);
    }

    @Test
    @DisplayName("정률 할인 곱셈이 long 범위를 넘는 주문 금액은 거부한다")
    void 정률_곱셈_범위_초과() {
        Coupon coupon = Coupon.grant("A-001", "전액 할인", CouponKind.BASIC, DiscountMode.PERCENTAGE, 100L, null);

        assertThatThrownBy(() -> coupon.calculateDiscount(184_467_440_737_095_517L))
                .isInstanceOf(InvalidCouponException.class)
                .hasMessageContaining("184467440737095517");
        assertThat(coupon.calculateDiscount(Long.MAX_VALUE / 100)).isEqualTo(Long.MAX_VALUE / 100);
    }

    @Test
    @DisplayName("할인 금액이 0원으로 내림되는 주문 금액은 거부한다")
    void 정률_할인_0원() {
        Coupon coupon = Coupon.grant("A-001", "15% 할인", CouponKind.BASIC, DiscountMode.PERCENTAGE, 15L, null);

        assertThatThrownBy(() -> coupon.calculateDiscount(6L))
                .isInstanceOf(InvalidCouponException.class);
        assertThat(coupon.calculateDiscount(7L)).isEqualTo(1L);
    }

    @Test
    @DisplayName("100% 를 넘는 할인율은 지급할 수 없다")
    void 할인율_상한() {
        assertThatThrownBy(() -> Coupon.grant("A-001", "이상한 쿠폰", CouponKind.BASIC, DiscountMode.PERCENTAGE, 120L, null))
                .isInstanceOf(InvalidCouponException.class);
    }

    @Test
    @DisplayName("만료 시각 자체까지는 사용 가능하고 그 이후는 만료다")
    void 만료_경계() {
        Coupon coupon = Coupon.grant("A-001", "기한 쿠폰", CouponKind.BASIC, DiscountMode.AMOUNT, 1_000L, NOW);

        assertThat(coupon.isUsableAt(NOW)).isTrue();
        assertThat(coupon.isUsableAt(NOW.plusSeconds(1))).isFalse();
    }

    @Test
    @DisplayName("만료일이 없는 쿠폰은 만료되지 않는다")
    void 무기한_쿠폰() {
        Coupon coupon = Coupon.grant("A-001", "무기한", CouponKind.BASIC, DiscountMode.AMOUNT, 1_000L, null);

        assertThat(coupon.isExpiredAt(NOW.plusYears(10))).isFalse();
        assertThat(coupon.isOwnedBy("A-001")).isTrue();
        assertThat(coupon.isOwnedBy("A-002")).isFalse();
    }
}
