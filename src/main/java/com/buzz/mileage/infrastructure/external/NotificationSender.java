package com.buzz.mileage.infrastructure.external;

import com.buzz.mileage.infrastructure.kafka.notification.message.ReferralCompletedMessage;
import com.buzz.mileage.infrastructure.kafka.notification.message.SettlementApprovedMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 알림 발송 (Mock)
 * 푸시/문자 발송 연동 전까지 로그로 대신한다
 */
@Slf4j
@Service
public class NotificationSender {

    public void sendReferralCompleted(ReferralCompletedMessage message) {
        log.info("[알림] 추천 보상 지급 - 추천인: {}, 보상: {}원 / 피추천인: {}, 가입 보너스: {}원",
                message.getReferrerId(), message.getRewardAmount(),
                message.getRefereeId(), message.getSignupBonus());
    }

    public void sendSettlementApproved(SettlementApprovedMessage message) {
        log.info("[알림] 정산 승인 - 가맹점: {}, 정산 ID: {}, 지급 예정액: {}원 (지원금 {}원 별도)",
                message.getMerchantId(), message.getSettlementId(),
                message.getNetAmount(), message.getSubsidyAmount());
    }
}
