package com.buzz.mileage.domain.promotion.entity;

import com.buzz.mileage.infrastructure.jpa.BaseEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 기간 한정 프로모션 이벤트
 * 운영 중 등록/종료가 가능한 유일한 보너스 입력값이다
 */
@Entity
@Table(name = "promotion_events", indexes = {
        @Index(name = "idx_promotion_events_type_period", columnList = "event_type, active, start_at, end_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class PromotionEvent extends BaseEntity {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String eventId;

    @Column(nullable = false)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 30)
    private PromotionEventType eventType;

    @Column(name = "bonus_amount", nullable = false)
    private long bonusAmount;

    @Column(name = "start_at", nullable = false)
    private LocalDateTime startAt;

    @Column(name = "end_at", nullable = false)
    private LocalDateTime endAt;

    @Column(nullable = false)
    private boolean active;

    public boolean isRunningAt(LocalDateTime now) {
        return active && !now.isBefore(startAt) && !now.isAfter(endAt);
    }
}
