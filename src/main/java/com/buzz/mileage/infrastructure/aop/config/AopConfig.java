package com.buzz.mileage.infrastructure.aop.config;

import com.buzz.mileage.infrastructure.aop.logtrace.LogTrace;
import com.buzz.mileage.infrastructure.aop.logtrace.LogTraceAspect;
import com.buzz.mileage.infrastructure.aop.logtrace.ThreadLocalLogTrace;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * @Trace 유스케이스 호출을 traceId 단위로 들여쓰기 로그로 남긴다
 */
@Configuration
public class AopConfig {

    @Bean
    public LogTraceAspect logTraceAspect(LogTrace logTrace) {
        return new LogTraceAspect(logTrace);
    }

    @Bean
    public LogTrace logTrace() {
        return new ThreadLocalLogTrace();
    }
}
