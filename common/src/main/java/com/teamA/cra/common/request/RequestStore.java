package com.teamA.cra.common.request;

import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.model.HistoryEntry;
import com.teamA.cra.common.domain.model.RequestItem;

import java.util.List;
import java.util.Optional;

/**
 * Request 영속성 포트
 *
 * - 조건부 쓰기 실패는 예외가 아니라 false로 돌려준다
 * - status + history 변경은 항상 한 번의 원자적 쓰기
 */
public interface RequestStore {

    /** strongly consistent read */
    Optional<RequestItem> findById(String requestId);

    /** 새 request 저장. draft + 세션키면 세션 pointer도 같이 기록. 이미 있으면 IllegalStateException */
    void insert(RequestItem item);

    /** status == draft 일 때만 필드를 덮어쓴다 (history/createdAt 보존은 호출자 책임) */
    boolean replaceDraft(RequestItem item);

    /** status == expectedStatus 일 때만 status 변경 + history append */
    boolean appendTransition(
            String requestId,
            RequestStatus expectedStatus,
            RequestStatus newStatus,
            List<HistoryEntry> entries,
            long updatedAt
    );

    /** 상태 변경 없는 필드 수정 (+ 선택적으로 history append), status == expectedStatus 조건 */
    boolean updateFields(RequestItem item, RequestStatus expectedStatus, List<HistoryEntry> appendEntries);

    /** 세션 pointer가 가리키는 requestId (상태는 호출자가 확인) */
    Optional<String> findDraftIdBySession(String creatorId, String draftSessionKey);

    /** 같은 세션으로 만들어진 draft 상태의 request id들 */
    List<String> findDraftIdsBySession(String creatorId, String draftSessionKey);

    /** status == draft 일 때만 삭제 */
    boolean deleteDraft(String requestId);

    List<RequestItem> findAll();
}
