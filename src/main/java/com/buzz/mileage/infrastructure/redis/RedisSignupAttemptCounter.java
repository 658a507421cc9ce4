package com.buzz.mileage.infrastructure.redis;

import com.buzz.mileage.domain.risk.service.SignupAttemptCounter;
import java.time.Clock;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * IP 별 가입 시도 카운터 (Redis Sorted Set)
 *
 * key: signup:attempts:ip:{ip}, member: attemptId, score: 시도 시각(epoch ms)
 * 윈도우 밖의 멤버는 기록 시 정리하고, 키에는 윈도우 길이만큼 TTL 을 건다.
 * Redis 장애는 호출 측(RiskGate)으로 전파되어 fail-open 처리된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisSignupAttemptCounter implements SignupAttemptCounter {

    private static final String KEY_PREFIX = "signup:attempts:ip:";

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;

    @Override
    public long countRecent(String ipAddress, Duration window) {
        long now = clock.millis();
        Long count = redisTemplate.opsForZSet()
                .count(key(ipAddress), now - window.toMillis(), now);
        return count == null ? 0L : count;
    }

    @Override
    public void record(String ipAddress, String attemptId, Duration window) {
        String key = key(ipAddress);
        long now = clock.millis();

        redisTemplate.opsForZSet().add(key, attemptId, now);
        redisTemplate.opsForZSet().removeRangeByScore(key, 0, now - window.toMillis());
        redisTemplate.expire(key, window);

        log.debug("가입 시도 기록 - ip={}, attemptId={}", ipAddress, attemptId);
    }

    private static String key(String ipAddress) {
        return KEY_PREFIX + ipAddress;
    }
}
