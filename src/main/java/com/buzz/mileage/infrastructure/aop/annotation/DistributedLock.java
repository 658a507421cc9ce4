package com.buzz.mileage.infrastructure.aop.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.TimeUnit;

/**
 * Redisson 분산 락 적용 어노테이션
 * key 는 SpEL 로 작성하며 메서드 파라미터 이름을 변수로 참조할 수 있다
 * 예) @DistributedLock(key = "'signup:'.concat(#command.email())")
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DistributedLock {

    String key();

    TimeUnit timeUnit() default TimeUnit.SECONDS;

    /**
     * 락 획득 대기 시간
     */
    long waitTime() default 10L;

    /**
     * 락 점유 시간 (초과 시 자동 해제)
     */
    long leaseTime() default 3L;

    /**
     * 락 저장소(Redis) 장애 시 락 없이 진행할지 여부
     * 락 외에 유니크 제약 같은 최종 방어선이 있는 메서드에만 켠다
     */
    boolean failOpen() default false;
}
