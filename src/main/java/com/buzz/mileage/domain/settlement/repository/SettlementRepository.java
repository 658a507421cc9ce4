package com.buzz.mileage.domain.settlement.repository;

import com.buzz.mileage.domain.settlement.entity.Settlement;
import com.buzz.mileage.domain.settlement.entity.SettlementStatus;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * 정산 Repository
 */
public interface SettlementRepository extends JpaRepository<Settlement, String> {

    Optional<Settlement> findByReferenceTypeAndReferenceId(String referenceType, String referenceId);

    List<Settlement> findByMerchantIdOrderByRequestedAtDesc(String merchantId);

    List<Settlement> findByMerchantIdAndStatusOrderByRequestedAtDesc(String merchantId, SettlementStatus status);

    long countByReferenceTypeAndReferenceId(String referenceType, String referenceId);
}
