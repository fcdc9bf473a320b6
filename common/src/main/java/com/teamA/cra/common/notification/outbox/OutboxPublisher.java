package com.teamA.cra.common.notification.outbox;

public interface OutboxPublisher {

    /** 실패 시 예외 (호출 측 Dispatcher가 격리한다) */
    void publish(OutboxEntry entry);
}
