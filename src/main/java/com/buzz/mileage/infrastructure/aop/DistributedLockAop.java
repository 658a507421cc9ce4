package com.buzz.mileage.infrastructure.aop;

import com.buzz.mileage.common.util.CustomSpringELParser;
import com.buzz.mileage.domain.common.exception.ConcurrentRequestException;
import com.buzz.mileage.infrastructure.aop.annotation.DistributedLock;
import java.lang.reflect.Method;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * {@link DistributedLock} 처리 Aspect
 *
 * 락 획득 → 새 트랜잭션에서 비즈니스 로직 실행 → 커밋 → 락 해제 순서를 보장한다
 * failOpen = true 인 메서드는 락 저장소 장애 시 락 없이 새 트랜잭션에서 실행한다
 */
@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "buzz.lock.distributed.enabled", havingValue = "true", matchIfMissing = true)
public class DistributedLockAop {

    private static final String REDISSON_LOCK_PREFIX = "lock:";

    private final RedissonClient redissonClient;
    private final AopForTransaction aopForTransaction;

    @Around("@annotation(com.buzz.mileage.infrastructure.aop.annotation.DistributedLock)")
    public Object lock(final ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        DistributedLock distributedLock = method.getAnnotation(DistributedLock.class);

        String key = REDISSON_LOCK_PREFIX + CustomSpringELParser.resolveKey(
                signature.getParameterNames(), joinPoint.getArgs(), distributedLock.key());
        RLock rLock = redissonClient.getLock(key);

        boolean acquired;
        try {
            acquired = rLock.tryLock(distributedLock.waitTime(), distributedLock.leaseTime(), distributedLock.timeUnit());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrentRequestException(key);
        } catch (RedisException e) {
            if (!distributedLock.failOpen()) {
                throw e;
            }
            log.warn("분산 락 저장소 장애 - 락 없이 진행. key={}, method={}", key, method.getName(), e);
            return aopForTransaction.proceed(joinPoint);
        }

        if (!acquired) {
            log.warn("분산 락 획득 실패 - key={}, method={}", key, method.getName());
            throw new ConcurrentRequestException(key);
        }

        try {
            return aopForTransaction.proceed(joinPoint);
        } finally {
            unlock(rLock, key);
        }
    }

    /**
     * 해제 실패는 leaseTime 만료로 정리되므로 커밋된 결과를 뒤집지 않는다
     */
    private void unlock(RLock rLock, String key) {
        try {
            if (rLock.isHeldByCurrentThread()) {
                rLock.unlock();
            } else {
                log.warn("분산 락이 이미 해제됨 (leaseTime 초과) - key={}", key);
            }
        } catch (RedisException e) {
            log.error("분산 락 해제 실패 - leaseTime 후 자동 해제. key={}", key, e);
        }
    }
}
