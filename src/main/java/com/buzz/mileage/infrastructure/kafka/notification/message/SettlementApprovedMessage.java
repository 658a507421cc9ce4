package com.buzz.mileage.infrastructure.kafka.notification.message;

import com.buzz.mileage.domain.settlement.entity.Settlement;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SettlementApprovedMessage {

    private String settlementId;
    private String merchantId;
    private String kind;
    private long grossAmount;
    private long subsidyAmount;
    private long netAmount;
    private String approvedBy;
    private LocalDateTime approvedAt;

    public static SettlementApprovedMessage from(Settlement settlement) {
        return new SettlementApprovedMessage(
                settlement.getSettlementId(),
                settlement.getMerchantId(),
                settlement.getKind().name(),
                settlement.getGrossAmount(),
                settlement.getSubsidyAmount(),
                settlement.getNetAmount(),
                settlement.getApprovedBy(),
                settlement.getApprovedAt()
        );
    }
}
