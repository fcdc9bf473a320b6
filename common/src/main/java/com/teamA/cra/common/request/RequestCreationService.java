package com.teamA.cra.common.request;

import com.teamA.cra.common.domain.enums.NotificationEventType;
import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.model.Actor;
import com.teamA.cra.common.domain.model.HistoryEntry;
import com.teamA.cra.common.domain.model.RequestItem;
import com.teamA.cra.common.domain.model.RequestPayload;
import com.teamA.cra.common.draft.DraftCreation;
import com.teamA.cra.common.draft.DraftIdempotencyGuard;
import com.teamA.cra.common.id.RequestIdGenerator;
import com.teamA.cra.common.notification.DispatchOutcome;
import com.teamA.cra.common.notification.NotificationDispatcher;
import com.teamA.cra.common.notification.NotificationEvent;
import com.teamA.cra.common.time.Clock;
import com.teamA.cra.common.transition.TransitionLegality;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.UUID;

/**
 * Request 생성
 *
 * - draft: DraftIdempotencyGuard 경유 (세션 중복 방지)
 * - draft가 아니면 (예: 바로 submitted) 새 id로 insert 후 request_created 알림
 */
@Slf4j
@RequiredArgsConstructor
public class RequestCreationService {

    private final DraftIdempotencyGuard draftGuard;
    private final RequestStore requestStore;
    private final RequestIdGenerator idGenerator;
    private final TransitionLegality legality;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    public CreatedRequest create(CreateRequestCommand command, Actor actor) {
        RequestStatus initial = resolveInitialStatus(command.status());
        Actor by = actor == null ? Actor.system() : actor;

        if (initial == RequestStatus.DRAFT) {
            DraftCreation draft = draftGuard.createOrReuseDraft(by, command.draftSessionKey(), command.payload());
            return new CreatedRequest(draft.request(), draft.created(), DispatchOutcome.skipped(DispatchOutcome.NOT_DISPATCHED));
        }

        RequestItem item = insertSubmitted(initial, command, by);
        DispatchOutcome outcome = notifyCreated(item, by);
        return new CreatedRequest(item, true, outcome);
    }

    /**
     * 초기 상태는 draft, 또는 draft에서 갈 수 있는 상태(취소 제외)만 허용
     */
    RequestStatus resolveInitialStatus(String requested) {
        if (requested == null || requested.isBlank()) {
            return RequestStatus.DRAFT;
        }
        RequestStatus status = RequestStatus.fromCode(requested)
                .filter(s -> legality.isKnownStatus(s.code()))
                .orElseThrow(() -> new IllegalArgumentException("Unknown status: " + requested));

        if (status == RequestStatus.DRAFT) return status;
        if (status == RequestStatus.CANCELLED || !legality.isAllowedTransition(RequestStatus.DRAFT, status)) {
            throw new IllegalArgumentException("A request cannot be created with status " + status.code());
        }
        return status;
    }

    private RequestItem insertSubmitted(RequestStatus initial, CreateRequestCommand command, Actor by) {
        long now = clock.nowMillis();
        RequestPayload p = command.payload() == null ? RequestPayload.empty() : command.payload();

        RequestItem item = RequestItem.builder()
                .requestId(idGenerator.nextId())
                .status(initial)
                .createdBy(by.id().isEmpty() ? null : by.id())
                .createdByName(by.name().isEmpty() ? null : by.name())
                .draftSessionKey(command.draftSessionKey())
                .clientName(p.getClientName())
                .bomFolderLink(p.getBomFolderLink())
                .attributes(p.getAttributes())
                .createdAt(now)
                .updatedAt(now)
                .history(List.of(new HistoryEntry("h-" + UUID.randomUUID(), initial, now, by.id(), by.name(), null)))
                .build();

        requestStore.insert(item);
        log.info("[REQUEST CREATED] requestId={} status={} by={}", item.getRequestId(), initial, by.id());
        return item;
    }

    private DispatchOutcome notifyCreated(RequestItem item, Actor by) {
        try {
            return notificationDispatcher.dispatch(NotificationEvent.builder()
                    .request(item)
                    .requestId(item.getRequestId())
                    .eventType(NotificationEventType.REQUEST_CREATED)
                    .status(item.getStatus())
                    .actorId(by.id())
                    .actorName(by.name())
                    .build());
        } catch (RuntimeException e) {
            log.error("[NOTIFY FAILED] requestId={} create notification", item.getRequestId(), e);
            return DispatchOutcome.skipped(DispatchOutcome.DISPATCH_FAILED);
        }
    }
}
