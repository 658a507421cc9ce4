package com.buzz.mileage.infrastructure.aop;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * 분산 락 내부에서 별도 트랜잭션으로 실행
 * 락 해제가 트랜잭션 커밋 이후에 일어나도록 보장한다
 */
@Slf4j
@Component
public class AopForTransaction {

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Object proceed(final ProceedingJoinPoint joinPoint) throws Throwable {
        log.debug("[락 트랜잭션] 시작 - method={}, active={}",
                joinPoint.getSignature().toShortString(),
                TransactionSynchronizationManager.isActualTransactionActive());
        return joinPoint.proceed();
    }
}
