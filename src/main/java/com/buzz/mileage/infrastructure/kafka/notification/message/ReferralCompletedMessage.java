package com.buzz.mileage.infrastructure.kafka.notification.message;

import com.buzz.mileage.domain.referral.entity.ReferralLink;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ReferralCompletedMessage {

    private String referralId;
    private String referrerId;
    private String refereeId;
    private long rewardAmount;
    private long signupBonus;
    private LocalDateTime completedAt;

    public static ReferralCompletedMessage from(ReferralLink link) {
        return new ReferralCompletedMessage(
                link.getReferralId(),
                link.getReferrerId(),
                link.getRefereeId(),
                link.getRewardAmount(),
                link.getSignupBonus(),
                link.getCreatedAt()
        );
    }
}
