package com.teamA.cra.common.support;

import com.teamA.cra.common.notification.DispatchOutcome;
import com.teamA.cra.common.notification.NotificationDispatcher;
import com.teamA.cra.common.notification.NotificationEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 받은 이벤트만 기록한다. failWith가 있으면 그 예외를 던진다.
 */
public class RecordingDispatcher implements NotificationDispatcher {

    private final List<NotificationEvent> events = new CopyOnWriteArrayList<>();
    private volatile RuntimeException failWith;

    @Override
    public DispatchOutcome dispatch(NotificationEvent event) {
        events.add(event);
        if (failWith != null) throw failWith;
        return DispatchOutcome.of(true, 0, 0);
    }

    public void failWith(RuntimeException e) {
        this.failWith = e;
    }

    public List<NotificationEvent> events() {
        return events;
    }
}
