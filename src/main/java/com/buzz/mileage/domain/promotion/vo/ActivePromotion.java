package com.buzz.mileage.domain.promotion.vo;

/**
 * 보너스 계산에 쓰이는 진행 중 이벤트 요약
 */
public record ActivePromotion(String eventId, String title, long bonusAmount) {
}
