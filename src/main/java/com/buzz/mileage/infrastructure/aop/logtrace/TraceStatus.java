package com.buzz.mileage.infrastructure.aop.logtrace;

public record TraceStatus(TraceId traceId, long startTimeMs, String message) {
}
