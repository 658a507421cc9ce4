package com.buzz.mileage.domain.promotion.repository;

import com.buzz.mileage.domain.promotion.entity.PromotionEvent;
import com.buzz.mileage.domain.promotion.entity.PromotionEventType;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PromotionEventRepository extends JpaRepository<PromotionEvent, String> {

    /**
     * 시점 now 에 진행 중인 이벤트 (금액 내림차순)
     */
    @Query("SELECT e FROM PromotionEvent e WHERE e.eventType = :type AND e.active = true " +
           "AND e.startAt <= :now AND e.endAt >= :now ORDER BY e.bonusAmount DESC")
    List<PromotionEvent> findActive(@Param("type") PromotionEventType type, @Param("now") LocalDateTime now);
}
