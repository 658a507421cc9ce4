package com.buzz.mileage.application.coupon.usecase;

import com.buzz.mileage.application.coupon.dto.CouponResponse;
import com.buzz.mileage.domain.account.exception.AccountNotFoundException;
import com.buzz.mileage.domain.account.repository.AccountRepository;
import com.buzz.mileage.domain.coupon.entity.Coupon;
import com.buzz.mileage.domain.coupon.repository.CouponRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 보유 쿠폰 목록 조회 유스케이스
 */
@Service
@RequiredArgsConstructor
public class GetAccountCouponsUseCase {

    private final AccountRepository accountRepository;
    private final CouponRepository couponRepository;

    /**
     * @param used null 이면 전체, true/false 면 사용 여부로 필터
     */
    @Transactional(readOnly = true)
    public List<CouponResponse> execute(String accountId, Boolean used) {
        if (!accountRepository.existsById(accountId)) {
            throw new AccountNotFoundException(accountId);
        }

        List<Coupon> coupons = used == null
                ? couponRepository.findByOwnerAccountIdOrderByCreatedAtDesc(accountId)
                : couponRepository.findByOwnerAccountIdAndUsedOrderByCreatedAtDesc(accountId, used);

        return coupons.stream()
                .map(CouponResponse::from)
                .toList();
    }
}
