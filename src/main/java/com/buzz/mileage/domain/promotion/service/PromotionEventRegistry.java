package com.buzz.mileage.domain.promotion.service;

import com.buzz.mileage.domain.promotion.entity.PromotionEventType;
import com.buzz.mileage.domain.promotion.repository.PromotionEventRepository;
import com.buzz.mileage.domain.promotion.vo.ActivePromotion;
import java.time.LocalDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 진행 중 이벤트 조회
 * 같은 종류의 이벤트가 여러 개 진행 중이면 금액이 가장 큰 것 하나만 적용한다
 */
@Service
@RequiredArgsConstructor
public class PromotionEventRegistry {

    private final PromotionEventRepository promotionEventRepository;

    @Transactional(readOnly = true)
    public Optional<ActivePromotion> findBestActive(PromotionEventType type, LocalDateTime now) {
        return promotionEventRepository.findActive(type, now).stream()
                .findFirst()
                .map(e -> new ActivePromotion(e.getEventId(), e.getTitle(), e.getBonusAmount()));
    }
}
