package com.teamA.cra.common.notification;

/**
 * 라이프사이클 이벤트 -> (즉시 메일 outbox, digest 큐, in-app 피드)
 *
 * 구현체는 호출자에게 예외를 던지지 않는다.
 */
public interface NotificationDispatcher {

    DispatchOutcome dispatch(NotificationEvent event);
}
