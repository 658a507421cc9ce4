package com.buzz.mileage.application.qr.service;

import com.buzz.mileage.application.qr.dto.RedeemCouponQrResponse;
import com.buzz.mileage.application.qr.dto.RedeemMileageQrResponse;
import com.buzz.mileage.domain.account.entity.Account;
import com.buzz.mileage.domain.account.exception.AccountNotFoundException;
import com.buzz.mileage.domain.account.exception.InactiveAccountException;
import com.buzz.mileage.domain.account.repository.AccountRepository;
import com.buzz.mileage.domain.coupon.entity.Coupon;
import com.buzz.mileage.domain.coupon.exception.CouponAlreadyUsedException;
import com.buzz.mileage.domain.coupon.exception.CouponExpiredException;
import com.buzz.mileage.domain.coupon.exception.CouponNotFoundException;
import com.buzz.mileage.domain.coupon.exception.InvalidCouponException;
import com.buzz.mileage.domain.coupon.repository.CouponRepository;
import com.buzz.mileage.domain.ledger.entity.LedgerCategory;
import com.buzz.mileage.domain.ledger.entity.LedgerEntry;
import com.buzz.mileage.domain.ledger.entity.LedgerReferenceType;
import com.buzz.mileage.domain.ledger.exception.InvalidLedgerAmountException;
import com.buzz.mileage.domain.ledger.service.MileageLedger;
import com.buzz.mileage.domain.ledger.vo.LedgerReference;
import com.buzz.mileage.domain.settlement.entity.Settlement;
import com.buzz.mileage.domain.settlement.service.SettlementGenerator;
import com.buzz.mileage.domain.token.entity.RedemptionToken;
import com.buzz.mileage.domain.token.entity.TokenKind;
import com.buzz.mileage.domain.token.exception.TokenKindMismatchException;
import com.buzz.mileage.domain.token.service.RedemptionTokenService;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * QR 사용 트랜잭션 처리 서비스
 *
 * 토큰 소비, 원장 차감 또는 쿠폰 사용 처리, 정산 요청 생성, 사용 이력 기록을 한 트랜잭션으로 묶는다.
 * 어느 단계에서 실패해도 전부 롤백되므로 "토큰은 사용됐는데 차감은 안 된" 상태가 생기지 않는다.
 *
 * 동시성 제어:
 * - 토큰: consumed = false 조건부 UPDATE
 * - 마일리지: balance >= amount 조건부 UPDATE
 * - 쿠폰: used = false 조건부 UPDATE
 * - 정산: (reference_type, reference_id), coupon_id 유니크 제약
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QrRedeemService {

    private final RedemptionTokenService redemptionTokenService;
    private final AccountRepository accountRepository;
    private final CouponRepository couponRepository;
    private final MileageLedger mileageLedger;
    private final SettlementGenerator settlementGenerator;
    private final Clock clock;

    @Transactional
    public RedeemMileageQrResponse redeemMileage(String payload, String merchantId, long amount) {
        if (amount <= 0) {
            throw new InvalidLedgerAmountException(amount);
        }

        RedemptionToken token = redemptionTokenService.resolve(payload);
        requireKind(token, TokenKind.MILEAGE);
        requireActive(token.getAccountId());

        // 1. 토큰 소비 (경합 패배 시 여기서 중단)
        redemptionTokenService.consume(token.getTokenId(), merchantId);

        // 2. 마일리지 차감 (잔액 부족이면 토큰 소비까지 롤백)
        LedgerEntry entry = mileageLedger.debit(token.getAccountId(), amount, LedgerCategory.SPEND,
                "가맹점 QR 사용 - " + merchantId,
                LedgerReference.of(LedgerReferenceType.QR_REDEEM, token.getTokenId()));

        // 3. 정산 요청
        Settlement settlement = settlementGenerator.forMileageUse(
                merchantId, token.getAccountId(), token.getTokenId(), amount);

        redemptionTokenService.recordUsage(token, merchantId, amount, null, 0L);

        log.info("마일리지 QR 사용 완료 - tokenId={}, merchantId={}, amount={}, balanceAfter={}",
                token.getTokenId(), merchantId, amount, entry.getBalanceAfter());
        return RedeemMileageQrResponse.from(token.getTokenId(), entry, settlement);
    }

    @Transactional
    public RedeemCouponQrResponse redeemCoupon(String payload, String merchantId, Long orderAmount) {
        RedemptionToken token = redemptionTokenService.resolve(payload);
        requireKind(token, TokenKind.COUPON);
        requireActive(token.getAccountId());

        LocalDateTime now = LocalDateTime.now(clock);
        Coupon coupon = couponRepository.findById(token.getReferenceId())
                .orElseThrow(() -> new CouponNotFoundException(token.getReferenceId()));
        if (!coupon.isOwnedBy(token.getAccountId())) {
            throw new InvalidCouponException("QR 발급 계정과 쿠폰 소유자가 다릅니다");
        }
        long discountAmount = coupon.calculateDiscount(orderAmount);

        // 1. 토큰 소비 (재사용된 QR 은 쿠폰 상태와 무관하게 여기서 Q004)
        redemptionTokenService.consume(token.getTokenId(), merchantId);

        if (coupon.isUsed()) {
            throw new CouponAlreadyUsedException(coupon.getCouponId());
        }
        if (coupon.isExpiredAt(now)) {
            throw new CouponExpiredException(coupon.getCouponId());
        }

        // 2. 쿠폰 사용 처리
        int updated = couponRepository.markUsed(coupon.getCouponId(), merchantId, now);
        if (updated == 0) {
            throw new CouponAlreadyUsedException(coupon.getCouponId());
        }

        // 3. 정산 요청 (이벤트 쿠폰은 정부 지원금 분리)
        Settlement settlement = settlementGenerator.forCouponUse(
                merchantId, token.getAccountId(), coupon, token.getTokenId(), discountAmount);

        redemptionTokenService.recordUsage(token, merchantId, orderAmount, discountAmount,
                settlement.getSubsidyAmount());

        log.info("쿠폰 QR 사용 완료 - tokenId={}, couponId={}, merchantId={}, discount={}, subsidy={}",
                token.getTokenId(), coupon.getCouponId(), merchantId, discountAmount, settlement.getSubsidyAmount());
        return RedeemCouponQrResponse.from(token.getTokenId(), settlement);
    }

    private static void requireKind(RedemptionToken token, TokenKind expected) {
        if (token.getKind() != expected) {
            throw new TokenKindMismatchException(expected, token.getKind());
        }
    }

    private void requireActive(String accountId) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
        if (!account.isActive()) {
            throw new InactiveAccountException(accountId);
        }
    }
}
