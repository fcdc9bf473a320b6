package com.teamA.cra.common.request;

import com.teamA.cra.common.domain.enums.NotificationEventType;
import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.model.Actor;
import com.teamA.cra.common.domain.model.HistoryEntry;
import com.teamA.cra.common.domain.model.RequestItem;
import com.teamA.cra.common.notification.DispatchOutcome;
import com.teamA.cra.common.notification.NotificationDispatcher;
import com.teamA.cra.common.notification.NotificationEvent;
import com.teamA.cra.common.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 상태 변경 없는 수정 + 재알림
 *
 * status / 상태 history는 여기서 바꾸지 않는다 (edited 마커만 예외)
 */
@Slf4j
@RequiredArgsConstructor
public class RequestEditService {

    static final int MAX_ATTEMPTS = 3;

    private final RequestStore requestStore;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    public EditedRequest edit(String requestId, EditRequestCommand command, Actor actor) {
        Actor by = actor == null ? Actor.system() : actor;

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            RequestItem current = requestStore.findById(requestId)
                    .orElseThrow(() -> new RequestNotFoundException(requestId));

            long now = clock.nowMillis();
            RequestItem merged = current.mergedWith(command.payload(), now);

            List<HistoryEntry> appended = new ArrayList<>();
            // draft 단계 수정은 이력 대상 아님
            if (command.markEdited() && current.getStatus() != RequestStatus.DRAFT) {
                long at = Math.max(now, current.lastHistoryTimestamp());
                appended.add(new HistoryEntry(
                        "h-" + UUID.randomUUID(), RequestStatus.EDITED, at, by.id(), by.name(), null));
            }

            boolean applied;
            RequestItem updated;
            if (current.getStatus() == RequestStatus.DRAFT) {
                updated = merged;
                applied = requestStore.replaceDraft(updated);
            } else {
                updated = appended.isEmpty() ? merged : merged.withTransition(current.getStatus(), appended, now);
                applied = requestStore.updateFields(merged, current.getStatus(), appended);
            }

            if (!applied) {
                log.info("[EDIT RETRY] requestId={} changed concurrently (attempt={})", requestId, attempt);
                continue;
            }

            log.info("[REQUEST EDITED] requestId={} status={} markEdited={} by={}",
                    requestId, current.getStatus(), !appended.isEmpty(), by.id());

            DispatchOutcome outcome = command.renotify() && current.getStatus() != RequestStatus.DRAFT
                    ? dispatchSafely(updated, NotificationEventType.REQUEST_STATUS_CHANGED,
                            updated.getStatus(), null, null, by)
                    : DispatchOutcome.skipped(DispatchOutcome.NOT_DISPATCHED);
            return new EditedRequest(updated, outcome);
        }

        throw new RequestConflictException(requestId);
    }

    /**
     * history 변경 없이 알림만 다시 보낸다.
     * status가 비어 있으면 현재 저장 상태 기준.
     */
    public DispatchOutcome renotify(
            String requestId,
            String eventType,
            String status,
            String previousStatus,
            String comment,
            Actor actor
    ) {
        Actor by = actor == null ? Actor.system() : actor;
        RequestItem current = requestStore.findById(requestId)
                .orElseThrow(() -> new RequestNotFoundException(requestId));

        NotificationEventType type = eventType == null || eventType.isBlank()
                ? NotificationEventType.REQUEST_STATUS_CHANGED
                : NotificationEventType.fromCode(eventType)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + eventType));

        RequestStatus target = status == null || status.isBlank()
                ? current.getStatus()
                : RequestStatus.fromCode(status)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown status: " + status));

        RequestStatus previous = previousStatus == null || previousStatus.isBlank()
                ? null
                : RequestStatus.fromCode(previousStatus)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown status: " + previousStatus));

        log.info("[RENOTIFY] requestId={} eventType={} status={} by={}", requestId, type.code(), target, by.id());
        return dispatchSafely(current, type, target, previous, comment, by);
    }

    private DispatchOutcome dispatchSafely(
            RequestItem request,
            NotificationEventType type,
            RequestStatus status,
            RequestStatus previous,
            String comment,
            Actor by
    ) {
        try {
            return notificationDispatcher.dispatch(NotificationEvent.builder()
                    .request(request)
                    .requestId(request.getRequestId())
                    .eventType(type)
                    .status(status)
                    .previousStatus(previous)
                    .actorId(by.id())
                    .actorName(by.name())
                    .comment(comment)
                    .build());
        } catch (RuntimeException e) {
            log.error("[NOTIFY FAILED] requestId={} status={}", request.getRequestId(), status, e);
            return DispatchOutcome.skipped(DispatchOutcome.DISPATCH_FAILED);
        }
    }
}
