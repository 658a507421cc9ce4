package com.buzz.mileage.domain.referral.repository;

import com.buzz.mileage.domain.referral.entity.ReferralLink;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ReferralLinkRepository extends JpaRepository<ReferralLink, String> {

    /**
     * 윈도우 내 완료된 추천 수 (since 이후)
     */
    long countByReferrerIdAndCreatedAtAfter(String referrerId, LocalDateTime since);

    boolean existsByRefereeId(String refereeId);

    List<ReferralLink> findByReferrerIdOrderByCreatedAtDesc(String referrerId);
}
