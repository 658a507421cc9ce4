package com.buzz.mileage.domain.token.repository;

import com.buzz.mileage.domain.token.entity.RedemptionToken;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * QR 토큰 Repository
 */
public interface RedemptionTokenRepository extends JpaRepository<RedemptionToken, String> {

    /**
     * 토큰 소비 (compare-and-set)
     * 아직 소비되지 않았고 만료 전인 토큰만 갱신된다.
     * 동시에 같은 토큰을 소비하려는 요청 중 하나만 1 을 받는다.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RedemptionToken t SET t.consumed = true, t.consumedBy = :merchantId, t.consumedAt = :now " +
           "WHERE t.tokenId = :tokenId AND t.consumed = false AND t.expiresAt >= :now")
    int consume(@Param("tokenId") String tokenId,
                @Param("merchantId") String merchantId,
                @Param("now") LocalDateTime now);

    /**
     * 보관 기간이 지난 미사용 만료 토큰 (소비된 토큰은 재사용 탐지를 위해 남긴다)
     */
    @Query("SELECT t FROM RedemptionToken t WHERE t.consumed = false AND t.expiresAt < :cutoff ORDER BY t.expiresAt ASC")
    List<RedemptionToken> findExpiredUnconsumedBefore(@Param("cutoff") LocalDateTime cutoff, Pageable pageable);
}
