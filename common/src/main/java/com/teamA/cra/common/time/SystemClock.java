package com.teamA.cra.common.time;

/**
 * 실제 시스템 시간을 사용하는 기본 구현체
 */
public class SystemClock implements Clock {

    private final java.time.Clock delegate;

    public SystemClock() {
        this(java.time.Clock.systemUTC());
    }

    public SystemClock(java.time.Clock delegate) {
        this.delegate = delegate;
    }

    @Override
    public long nowMillis() {
        return delegate.millis();
    }
}
