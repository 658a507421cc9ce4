package com.buzz.mileage.application.coupon.usecase;

import com.buzz.mileage.application.coupon.dto.CouponResponse;
import com.buzz.mileage.application.coupon.dto.IssueCouponRequest;
import com.buzz.mileage.domain.account.entity.Account;
import com.buzz.mileage.domain.account.exception.AccountNotFoundException;
import com.buzz.mileage.domain.account.exception.InactiveAccountException;
import com.buzz.mileage.domain.account.repository.AccountRepository;
import com.buzz.mileage.domain.coupon.entity.Coupon;
import com.buzz.mileage.domain.coupon.repository.CouponRepository;
import com.buzz.mileage.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 쿠폰 지급 유스케이스 (관리자)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IssueCouponUseCase {

    private final AccountRepository accountRepository;
    private final CouponRepository couponRepository;

    @Trace
    @Transactional
    public CouponResponse execute(String accountId, IssueCouponRequest request) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
        if (!account.isActive()) {
            throw new InactiveAccountException(accountId);
        }

        Coupon coupon = couponRepository.save(Coupon.grant(
                accountId,
                request.name(),
                request.kind(),
                request.discountMode(),
                request.discountValue(),
                request.expiresAt()));

        log.info("쿠폰 지급 - couponId={}, accountId={}, kind={}, mode={}, value={}",
                coupon.getCouponId(), accountId, coupon.getKind(), coupon.getDiscountMode(), coupon.getDiscountValue());
        return CouponResponse.from(coupon);
    }
}
