package com.buzz.mileage.domain.settlement.service;

import com.buzz.mileage.domain.coupon.entity.Coupon;
import com.buzz.mileage.domain.settlement.entity.Settlement;
import com.buzz.mileage.domain.settlement.repository.SettlementRepository;
import com.buzz.mileage.domain.settlement.vo.SettlementAmount;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * QR 사용 1건을 정산 요청 1건으로 변환
 *
 * 토큰 소비, 원장 차감(또는 쿠폰 사용 처리)과 같은 트랜잭션에서만 호출된다.
 * reference(QR_TOKEN, tokenId) 유니크 제약이 중복 정산의 마지막 방어선이다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementGenerator {

    private final SettlementRepository settlementRepository;
    private final SettlementCalculator settlementCalculator;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public Settlement forMileageUse(String merchantId, String accountId, String tokenId, long spendAmount) {
        SettlementAmount amount = settlementCalculator.forMileage(spendAmount);
        return save(Settlement.request(merchantId, accountId, null, tokenId, amount, LocalDateTime.now(clock)));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Settlement forCouponUse(String merchantId, String accountId, Coupon coupon, String tokenId, long discountAmount) {
        SettlementAmount amount = settlementCalculator.forCoupon(coupon.getKind(), discountAmount);
        return save(Settlement.request(merchantId, accountId, coupon.getCouponId(), tokenId, amount, LocalDateTime.now(clock)));
    }

    private Settlement save(Settlement settlement) {
        // 유니크 위반을 커밋 시점이 아니라 여기서 드러나게 한다
        Settlement saved = settlementRepository.saveAndFlush(settlement);
        log.info("정산 요청 생성 - settlementId={}, merchantId={}, kind={}, gross={}, subsidy={}, net={}",
                saved.getSettlementId(), saved.getMerchantId(), saved.getKind(),
                saved.getGrossAmount(), saved.getSubsidyAmount(), saved.getNetAmount());
        return saved;
    }
}
