package com.buzz.mileage.infrastructure.scheduler;

import com.buzz.mileage.common.config.QrTokenProperties;
import com.buzz.mileage.domain.token.service.RedemptionTokenService;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 만료 QR 토큰 정리 스케줄러
 * 사용된 토큰은 재사용 탐지를 위해 남기고, 보관 기간이 지난 미사용 만료 토큰만 지운다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenRetentionScheduler {

    private final RedemptionTokenService redemptionTokenService;
    private final QrTokenProperties qrTokenProperties;
    private final Clock clock;

    @Scheduled(cron = "${buzz.qr.retention-cron:0 30 3 * * *}")
    public void purgeExpiredTokens() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(qrTokenProperties.getRetentionDays());

        int total = 0;
        int purged;
        do {
            purged = redemptionTokenService.purgeExpired(cutoff);
            total += purged;
        } while (purged > 0);

        log.info("만료 QR 토큰 정리 완료 - cutoff={}, total={}", cutoff, total);
    }
}
