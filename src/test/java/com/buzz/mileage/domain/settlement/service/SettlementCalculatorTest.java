package com.buzz.mileage.domain.settlement.service;

import com.buzz.mileage.domain.coupon.entity.CouponKind;
import com.buzz.mileage.domain.settlement.entity.SettlementKind;
import com.buzz.mileage.domain.settlement.vo.SettlementAmount;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("정산 금액 계산 테스트")
class SettlementCalculatorTest {

    private final SettlementCalculator calculator = new SettlementCalculator(50);

    @Test
    @DisplayName("이벤트 쿠폰 할인 10,000원은 정부 지원 5,000원 / 가맹점 부담 5,000원으로 나뉜다")
    void 이벤트_쿠폰_분리() {
        // when
        SettlementAmount amount = calculator.forCoupon(CouponKind.EVENT, 10_000L);

        // then
        assertThat(amount.kind()).isEqualTo(SettlementKind.EVENT_COUPON);
        assertThat(amount.gross()).isEqualTo(10_000L);
        assertThat(amount.subsidy()).isEqualTo(5_000L);
        assertThat(amount.net()).isEqualTo(5_000L);
    }

    @Test
    @DisplayName("일반 쿠폰은 지원금 없이 할인액 전부가 가맹점 정산액이다")
    void 일반_쿠폰() {
        // when
        SettlementAmount amount = calculator.forCoupon(CouponKind.BASIC, 10_000L);

        // then
        assertThat(amount.kind()).isEqualTo(SettlementKind.BASIC_COUPON);
        assertThat(amount.subsidy()).isZero();
        assertThat(amount.net()).isEqualTo(10_000L);
    }

    @Test
    @DisplayName("마일리지 사용은 사용 금액 전부가 정산액이다")
    void 마일리지_사용() {
        // when
        SettlementAmount amount = calculator.forMileage(3_000L);

        // then
        assertThat(amount.kind()).isEqualTo(SettlementKind.MILEAGE_USE);
        assertThat(amount.gross()).isEqualTo(3_000L);
        assertThat(amount.net()).isEqualTo(3_000L);
    }

    @Test
    @DisplayName("지원금은 내림 처리되고 나머지는 가맹점 부담이다")
    void 지원금_내림() {
        // given
        SettlementCalculator thirtyPercent = new SettlementCalculator(30);

        // when
        SettlementAmount amount = thirtyPercent.forCoupon(CouponKind.EVENT, 9_999L);

        // then
        assertThat(amount.subsidy()).isEqualTo(2_999L);
        assertThat(amount.net()).isEqualTo(7_000L);
        assertThat(amount.subsidy() + amount.net()).isEqualTo(amount.gross());
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 101})
    @DisplayName("정부 지원 비율은 0~100 범위만 허용한다")
    void 비율_범위(int ratio) {
        assertThatThrownBy(() -> new SettlementCalculator(ratio))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
