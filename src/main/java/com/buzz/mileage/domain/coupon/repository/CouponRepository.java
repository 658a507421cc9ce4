package com.buzz.mileage.domain.coupon.repository;

import com.buzz.mileage.domain.coupon.entity.Coupon;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * 쿠폰 저장소
 */
public interface CouponRepository extends JpaRepository<Coupon, String> {

    List<Coupon> findByOwnerAccountIdOrderByCreatedAtDesc(String ownerAccountId);

    List<Coupon> findByOwnerAccountIdAndUsedOrderByCreatedAtDesc(String ownerAccountId, boolean used);

    /**
     * 쿠폰 사용 처리 (compare-and-set)
     * 이미 사용된 쿠폰이면 0 을 반환한다
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Coupon c SET c.used = true, c.usedByMerchantId = :merchantId, c.usedAt = :now " +
           "WHERE c.couponId = :couponId AND c.used = false")
    int markUsed(@Param("couponId") String couponId,
                 @Param("merchantId") String merchantId,
                 @Param("now") LocalDateTime now);
}
