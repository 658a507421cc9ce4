package com.buzz.mileage.application.settlement.usecase;

import com.buzz.mileage.application.settlement.dto.SettlementResponse;
import com.buzz.mileage.domain.settlement.entity.Settlement;
import com.buzz.mileage.domain.settlement.entity.SettlementStatus;
import com.buzz.mileage.domain.settlement.exception.SettlementNotFoundException;
import com.buzz.mileage.domain.settlement.repository.SettlementRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 정산 조회 유스케이스
 */
@Service
@RequiredArgsConstructor
public class GetMerchantSettlementsUseCase {

    private final SettlementRepository settlementRepository;

    /**
     * @param status null 이면 전체
     */
    @Transactional(readOnly = true)
    public List<SettlementResponse> execute(String merchantId, SettlementStatus status) {
        List<Settlement> settlements = status == null
                ? settlementRepository.findByMerchantIdOrderByRequestedAtDesc(merchantId)
                : settlementRepository.findByMerchantIdAndStatusOrderByRequestedAtDesc(merchantId, status);

        return settlements.stream()
                .map(SettlementResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public SettlementResponse getOne(String settlementId) {
        return settlementRepository.findById(settlementId)
                .map(SettlementResponse::from)
                .orElseThrow(() -> new SettlementNotFoundException(settlementId));
    }
}
