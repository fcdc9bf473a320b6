package com.teamA.cra.common.transition;

import com.teamA.cra.common.domain.enums.NotificationEventType;
import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.model.Actor;
import com.teamA.cra.common.domain.model.HistoryEntry;
import com.teamA.cra.common.domain.model.RequestItem;
import com.teamA.cra.common.notification.DispatchOutcome;
import com.teamA.cra.common.notification.NotificationDispatcher;
import com.teamA.cra.common.notification.NotificationEvent;
import com.teamA.cra.common.request.RequestStore;
import com.teamA.cra.common.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Status Transition Engine
 *
 * 1) 상태 코드 검증 -> 2) 규칙표 검증 -> 3) 업무 가드 -> 4) 조건부 append -> 5) 부수효과 -> 6) 알림
 *
 * GM 반려는 history에 [gm_rejected, sales_followup] 두 줄을 한 번에 쓰고
 * 저장 status는 sales_followup이 된다.
 */
@Slf4j
@RequiredArgsConstructor
public class RequestStateTransitionService implements StateTransitionService {

    static final int MAX_ATTEMPTS = 3;

    private final RequestStore requestStore;
    private final TransitionLegality legality;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    @Override
    public TransitionResult applyTransition(String requestId, String requestedStatus, String comment, Actor actor) {
        // 1) 상태 코드
        Optional<RequestStatus> parsed = RequestStatus.fromCode(requestedStatus);
        if (parsed.isEmpty() || !legality.isKnownStatus(requestedStatus)) {
            return new TransitionResult.UnknownStatus(requestedStatus);
        }
        RequestStatus requested = parsed.get();
        Actor by = actor == null ? Actor.system() : actor;

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Optional<RequestItem> loaded = requestStore.findById(requestId);
            if (loaded.isEmpty()) {
                return new TransitionResult.NotFound(requestId);
            }
            RequestItem current = loaded.get();
            RequestStatus from = current.getStatus();

            // 2) 규칙표
            if (!legality.isAllowedTransition(from, requested)) {
                return new TransitionResult.IllegalTransition(from, requested, legality.allowedTransitions(from));
            }

            // 3) 업무 가드 (쓰기 전에)
            Optional<TransitionResult> guardFailure = checkGuards(current, requested, comment);
            if (guardFailure.isPresent()) {
                return guardFailure.get();
            }

            // 4) history 작성 + 조건부 append (status == from)
            long now = clock.nowMillis();
            List<HistoryEntry> entries = buildEntries(current, requested, comment, by, now);
            RequestStatus persisted = persistedStatusFor(requested);

            boolean applied = requestStore.appendTransition(requestId, from, persisted, entries, now);
            if (!applied) {
                log.info("[TRANSITION RETRY] requestId={} status changed concurrently (attempt={})", requestId, attempt);
                continue;
            }

            RequestItem updated = current.withTransition(persisted, entries, now);
            log.info("[TRANSITION] requestId={} {} -> {} (persisted={}) by={}",
                    requestId, from, requested, persisted, by.id());

            // 5) draft 제출이면 같은 세션의 버려진 draft 정리
            if (from == RequestStatus.DRAFT && persisted != RequestStatus.DRAFT) {
                purgeSiblingDrafts(updated);
            }

            // 6) 알림 (best-effort)
            DispatchOutcome outcome = notifyTransition(updated, requested, from, comment, by);
            return new TransitionResult.Success(updated, from, outcome);
        }

        log.warn("[TRANSITION CONFLICT] requestId={} gave up after {} attempts", requestId, MAX_ATTEMPTS);
        return new TransitionResult.ConditionFailed(requestId);
    }

    private Optional<TransitionResult> checkGuards(RequestItem current, RequestStatus requested, String comment) {
        boolean hasComment = comment != null && !comment.isBlank();

        if (requested == RequestStatus.CANCELLED && !hasComment) {
            return Optional.of(new TransitionResult.MissingRequiredField(
                    "comment", "A comment is required to cancel a request"));
        }
        if (requested == RequestStatus.GM_APPROVAL_PENDING
                && current.everHadStatus(RequestStatus.GM_REJECTED)
                && !hasComment) {
            return Optional.of(new TransitionResult.MissingRequiredField(
                    "comment", "A comment is required to resubmit after a GM rejection"));
        }
        if (requested == RequestStatus.DESIGN_RESULT && !current.hasBomFolderLink()) {
            return Optional.of(new TransitionResult.MissingRequiredField(
                    "bomFolderLink", "A BOM folder link is required before moving to design result"));
        }
        return Optional.empty();
    }

    /**
     * timestamp는 엔진이 부여한다.
     * 시계가 뒤로 가도 마지막 history보다 앞서지 않게 맞춘다.
     */
    private List<HistoryEntry> buildEntries(
            RequestItem current,
            RequestStatus requested,
            String comment,
            Actor actor,
            long now
    ) {
        long at = Math.max(now, current.lastHistoryTimestamp());
        String trimmedComment = comment == null || comment.isBlank() ? null : comment.trim();

        if (requested == RequestStatus.GM_REJECTED) {
            // 반려 이벤트 -> 1 tick 뒤 sales_followup (시간순 질의에서 반려가 항상 먼저)
            return List.of(
                    newEntry(RequestStatus.GM_REJECTED, at, actor, trimmedComment),
                    newEntry(RequestStatus.SALES_FOLLOWUP, at + 1, actor, null)
            );
        }
        return List.of(newEntry(requested, at, actor, trimmedComment));
    }

    private HistoryEntry newEntry(RequestStatus status, long at, Actor actor, String comment) {
        return new HistoryEntry("h-" + UUID.randomUUID(), status, at, actor.id(), actor.name(), comment);
    }

    static RequestStatus persistedStatusFor(RequestStatus requested) {
        return requested == RequestStatus.GM_REJECTED ? RequestStatus.SALES_FOLLOWUP : requested;
    }

    private void purgeSiblingDrafts(RequestItem submitted) {
        if (!submitted.hasDraftSession()) return;
        try {
            List<String> siblings = requestStore.findDraftIdsBySession(
                    submitted.getCreatedBy(), submitted.getDraftSessionKey());
            int purged = 0;
            for (String siblingId : siblings) {
                if (siblingId.equals(submitted.getRequestId())) continue;
                if (requestStore.deleteDraft(siblingId)) purged++;
            }
            if (purged > 0) {
                log.info("[DRAFT PURGE] requestId={} purged {} sibling draft(s)", submitted.getRequestId(), purged);
            }
        } catch (RuntimeException e) {
            // 정리는 부수효과, 전이는 이미 확정
            log.warn("[DRAFT PURGE FAILED] requestId={}", submitted.getRequestId(), e);
        }
    }

    private DispatchOutcome notifyTransition(
            RequestItem updated,
            RequestStatus requested,
            RequestStatus previous,
            String comment,
            Actor actor
    ) {
        // 알림 기준 상태: 반려면 gm_rejected 그대로
        RequestStatus notificationStatus = requested == RequestStatus.GM_REJECTED
                ? RequestStatus.GM_REJECTED
                : updated.getStatus();

        if (notificationStatus == previous) {
            return DispatchOutcome.skipped(DispatchOutcome.NOT_DISPATCHED);
        }

        try {
            return notificationDispatcher.dispatch(NotificationEvent.builder()
                    .request(updated)
                    .requestId(updated.getRequestId())
                    .eventType(NotificationEventType.REQUEST_STATUS_CHANGED)
                    .status(notificationStatus)
                    .previousStatus(previous)
                    .actorId(actor.id())
                    .actorName(actor.name())
                    .comment(comment)
                    .build());
        } catch (RuntimeException e) {
            log.error("[NOTIFY FAILED] requestId={} status={}", updated.getRequestId(), notificationStatus, e);
            return DispatchOutcome.skipped(DispatchOutcome.DISPATCH_FAILED);
        }
    }
}
