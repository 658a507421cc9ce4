package com.buzz.mileage.infrastructure.outbox;

/**
 * Outbox 이벤트 종류와 발행 토픽
 */
public enum OutboxEventType {
    REFERRAL_COMPLETED("REFERRAL", "referral-events"),
    SETTLEMENT_APPROVED("SETTLEMENT", "settlement-events");

    private final String aggregateType;
    private final String topic;

    OutboxEventType(String aggregateType, String topic) {
        this.aggregateType = aggregateType;
        this.topic = topic;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getTopic() {
        return topic;
    }
}
