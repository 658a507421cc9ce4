package com.buzz.mileage.infrastructure.risk;

import com.buzz.mileage.common.config.RiskProperties;
import com.buzz.mileage.domain.risk.repository.IpBlacklistRepository;
import com.buzz.mileage.domain.risk.service.IpReputationChecker;
import com.buzz.mileage.domain.risk.vo.IpReputation;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 설정 목록 + 차단 테이블 기반 IP 평판 판정
 * 외부 평판 API 로 바꿀 때는 IpReputationChecker 구현만 교체한다
 */
@Component
@RequiredArgsConstructor
public class ConfiguredIpReputationChecker implements IpReputationChecker {

    private final RiskProperties riskProperties;
    private final IpBlacklistRepository ipBlacklistRepository;
    private final Clock clock;

    @Override
    public IpReputation check(String ipAddress) {
        if (ipAddress == null || ipAddress.isBlank()) {
            return IpReputation.clean();
        }
        return new IpReputation(
                riskProperties.getTorExitNodes().contains(ipAddress),
                startsWithAny(ipAddress, riskProperties.getVpnPrefixes()),
                startsWithAny(ipAddress, riskProperties.getDatacenterPrefixes()),
                ipBlacklistRepository.isBlacklisted(ipAddress, LocalDateTime.now(clock)));
    }

    private static boolean startsWithAny(String ipAddress, List<String> prefixes) {
        return prefixes.stream().anyMatch(ipAddress::startsWith);
    }
}
