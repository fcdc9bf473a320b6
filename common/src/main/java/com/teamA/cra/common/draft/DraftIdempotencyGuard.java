package com.teamA.cra.common.draft;

import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.model.Actor;
import com.teamA.cra.common.domain.model.HistoryEntry;
import com.teamA.cra.common.domain.model.RequestItem;
import com.teamA.cra.common.domain.model.RequestPayload;
import com.teamA.cra.common.id.RequestIdGenerator;
import com.teamA.cra.common.lock.AdvisoryLockManager;
import com.teamA.cra.common.request.RequestStore;
import com.teamA.cra.common.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 같은 (creator, draftSessionKey)로 draft가 두 개 생기는 것을 막는다.
 *
 * - lock 안에서: 세션 pointer 조회 -> draft면 병합, 아니면 새로 생성
 * - lock은 이 단위 작업 동안만 (알림 작업과 무관)
 * - creator/세션키가 비어 있으면 guard 없이 바로 생성
 */
@Slf4j
@RequiredArgsConstructor
public class DraftIdempotencyGuard {

    private final RequestStore requestStore;
    private final RequestIdGenerator idGenerator;
    private final AdvisoryLockManager lockManager;
    private final Clock clock;

    public DraftCreation createOrReuseDraft(Actor creator, String draftSessionKey, RequestPayload payload) {
        Actor by = creator == null ? new Actor(null, null) : creator;
        String sessionKey = draftSessionKey == null ? null : draftSessionKey.trim();

        if (by.id().isEmpty() || sessionKey == null || sessionKey.isEmpty()) {
            return new DraftCreation(insertNew(by, null, payload), true);
        }

        return lockManager.withLock(by.id(), sessionKey, () -> {
            Optional<RequestItem> existing = findOpenDraft(by.id(), sessionKey);
            if (existing.isPresent()) {
                RequestItem merged = existing.get().mergedWith(payload, clock.nowMillis());
                if (requestStore.replaceDraft(merged)) {
                    log.info("[DRAFT REUSED] requestId={} creator={} session={}",
                            merged.getRequestId(), by.id(), sessionKey);
                    return new DraftCreation(merged, false);
                }
                // lock 밖 경로(상태 전이)로 방금 draft를 벗어난 경우 -> 새 draft
                log.info("[DRAFT LEFT] requestId={} no longer draft, creating new", merged.getRequestId());
            }
            return new DraftCreation(insertNew(by, sessionKey, payload), true);
        });
    }

    private Optional<RequestItem> findOpenDraft(String creatorId, String sessionKey) {
        Optional<String> pointed = requestStore.findDraftIdBySession(creatorId, sessionKey);
        if (pointed.isEmpty()) return Optional.empty();

        // pointer가 가리키는 draft도 같은 (creator, session) 것이어야 재사용
        return requestStore.findById(pointed.get())
                .filter(item -> item.getStatus() == RequestStatus.DRAFT)
                .filter(item -> creatorId.equals(item.getCreatedBy())
                        && sessionKey.equals(item.getDraftSessionKey()));
    }

    private RequestItem insertNew(Actor creator, String sessionKey, RequestPayload payload) {
        long now = clock.nowMillis();
        RequestPayload p = payload == null ? RequestPayload.empty() : payload;

        RequestItem item = RequestItem.builder()
                .requestId(idGenerator.nextId())
                .status(RequestStatus.DRAFT)
                .createdBy(creator.id().isEmpty() ? null : creator.id())
                .createdByName(creator.name().isEmpty() ? null : creator.name())
                .draftSessionKey(sessionKey)
                .clientName(p.getClientName())
                .bomFolderLink(p.getBomFolderLink())
                .attributes(p.getAttributes())
                .createdAt(now)
                .updatedAt(now)
                .history(List.of(new HistoryEntry(
                        "h-" + UUID.randomUUID(), RequestStatus.DRAFT, now, creator.id(), creator.name(), null)))
                .build();

        requestStore.insert(item);
        log.info("[DRAFT CREATED] requestId={} creator={} session={}", item.getRequestId(), creator.id(), sessionKey);
        return item;
    }
}
