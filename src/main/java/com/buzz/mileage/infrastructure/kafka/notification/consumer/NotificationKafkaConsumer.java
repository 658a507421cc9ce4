package com.buzz.mileage.infrastructure.kafka.notification.consumer;

import com.buzz.mileage.infrastructure.external.NotificationSender;
import com.buzz.mileage.infrastructure.kafka.notification.message.ReferralCompletedMessage;
import com.buzz.mileage.infrastructure.kafka.notification.message.SettlementApprovedMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * 추천 완료 / 정산 승인 알림 Consumer
 *
 * 역직렬화할 수 없는 메시지는 재시도해도 결과가 같으므로 로그만 남기고 건너뛴다.
 * 발송 실패는 그대로 던져 컨테이너 에러 핸들러가 재시도하게 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationKafkaConsumer {

    private final NotificationSender notificationSender;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = "referral-events",
            groupId = "buzz-notification-group",
            concurrency = "2"
    )
    public void consumeReferralCompleted(String payload) {
        ReferralCompletedMessage message;
        try {
            message = objectMapper.readValue(payload, ReferralCompletedMessage.class);
        } catch (JsonProcessingException e) {
            log.error("[Kafka Consumer] 추천 완료 메시지 역직렬화 실패 - payload={}", payload, e);
            return;
        }

        log.info("[Kafka Consumer] 추천 완료 메시지 수신 - Referral ID: {}, Referrer: {}",
                message.getReferralId(), message.getReferrerId());
        notificationSender.sendReferralCompleted(message);
    }

    @KafkaListener(
            topics = "settlement-events",
            groupId = "buzz-notification-group",
            concurrency = "2"
    )
    public void consumeSettlementApproved(String payload) {
        SettlementApprovedMessage message;
        try {
            message = objectMapper.readValue(payload, SettlementApprovedMessage.class);
        } catch (JsonProcessingException e) {
            log.error("[Kafka Consumer] 정산 승인 메시지 역직렬화 실패 - payload={}", payload, e);
            return;
        }

        log.info("[Kafka Consumer] 정산 승인 메시지 수신 - Settlement ID: {}, Merchant: {}",
                message.getSettlementId(), message.getMerchantId());
        notificationSender.sendSettlementApproved(message);
    }
}
