package com.buzz.mileage.application.qr.service;

import com.buzz.mileage.common.config.QrTokenProperties;
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
import com.buzz.mileage.domain.ledger.exception.InsufficientBalanceException;
import com.buzz.mileage.domain.token.entity.TokenKind;
import com.buzz.mileage.domain.token.service.RedemptionTokenService;
import com.buzz.mileage.domain.token.vo.IssuedToken;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * QR 발급 전 조건 확인
 * - 마일리지 QR: 활성 계정, 잔액 > 0
 * - 쿠폰 QR: 본인 소유, 미사용, 미만료 쿠폰
 */
@Service
@RequiredArgsConstructor
public class QrIssueService {

    private final AccountRepository accountRepository;
    private final CouponRepository couponRepository;
    private final RedemptionTokenService redemptionTokenService;
    private final QrTokenProperties qrTokenProperties;
    private final Clock clock;

    @Transactional
    public IssuedToken issueMileage(String accountId) {
        Account account = activeAccount(accountId);
        if (account.getBalanceAmount() <= 0) {
            throw new InsufficientBalanceException(1L, account.getBalanceAmount());
        }
        return redemptionTokenService.issue(accountId, TokenKind.MILEAGE, null, qrTokenProperties.getTokenTtl());
    }

    @Transactional
    public IssuedToken issueCoupon(String accountId, String couponId) {
        activeAccount(accountId);

        Coupon coupon = couponRepository.findById(couponId)
                .orElseThrow(() -> new CouponNotFoundException(couponId));
        if (!coupon.isOwnedBy(accountId)) {
            throw new InvalidCouponException("본인 소유의 쿠폰만 QR 로 사용할 수 있습니다");
        }
        if (coupon.isUsed()) {
            throw new CouponAlreadyUsedException(couponId);
        }
        if (coupon.isExpiredAt(LocalDateTime.now(clock))) {
            throw new CouponExpiredException(couponId);
        }
        return redemptionTokenService.issue(accountId, TokenKind.COUPON, couponId, qrTokenProperties.getTokenTtl());
    }

    private Account activeAccount(String accountId) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
        if (!account.isActive()) {
            throw new InactiveAccountException(accountId);
        }
        return account;
    }
}
