package com.buzz.mileage.infrastructure.aop.logtrace;

import java.util.UUID;

/**
 * 요청 단위 추적 ID + 호출 깊이
 */
public class TraceId {

    private final String id;
    private final int level;

    public TraceId() {
        this(UUID.randomUUID().toString().substring(0, 8), 0);
    }

    private TraceId(String id, int level) {
        this.id = id;
        this.level = level;
    }

    public TraceId createNextId() {
        return new TraceId(id, level + 1);
    }

    public TraceId createPreviousId() {
        return new TraceId(id, level - 1);
    }

    public boolean isFirstLevel() {
        return level == 0;
    }

    public String getId() {
        return id;
    }

    public int getLevel() {
        return level;
    }
}
