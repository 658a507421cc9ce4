package com.buzz.mileage.infrastructure.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 분산 락 설정
 * 가입 요청 직렬화(@DistributedLock)에 사용하는 RedissonClient 빈을 생성
 */
@Configuration
@ConditionalOnProperty(name = "buzz.lock.distributed.enabled", havingValue = "true", matchIfMissing = true)
public class RedissonConfig {

    private static final String REDIS_PROTOCOL_PREFIX = "redis://";

    private static final int CONNECTION_MINIMUM_IDLE_SIZE = 10;
    private static final int CONNECTION_POOL_SIZE = 20;
    private static final int IDLE_CONNECTION_TIMEOUT = 10000;
    private static final int CONNECT_TIMEOUT = 3000;
    private static final int COMMAND_TIMEOUT = 3000;

    @Value("${spring.data.redis.host}")
    private String redisHost;

    @Value("${spring.data.redis.port}")
    private int redisPort;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        Config config = new Config();
        config.useSingleServer()
                .setAddress(REDIS_PROTOCOL_PREFIX + redisHost + ":" + redisPort)
                .setConnectionMinimumIdleSize(CONNECTION_MINIMUM_IDLE_SIZE)
                .setConnectionPoolSize(CONNECTION_POOL_SIZE)
                .setIdleConnectionTimeout(IDLE_CONNECTION_TIMEOUT)
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setTimeout(COMMAND_TIMEOUT);

        return Redisson.create(config);
    }
}
