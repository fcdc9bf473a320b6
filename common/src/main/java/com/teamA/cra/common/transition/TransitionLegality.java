package com.teamA.cra.common.transition;

import com.teamA.cra.common.domain.enums.RequestStatus;

import java.util.Set;

/**
 * "어떤 상태 다음에 어떤 상태가 올 수 있는가" 규칙표 (외부 협력자)
 *
 * 엔진은 이 규칙표의 내용을 모른다. 질의만 한다.
 */
public interface TransitionLegality {

    boolean isKnownStatus(String status);

    boolean isAllowedTransition(RequestStatus from, RequestStatus to);

    /** from에서 갈 수 있는 다음 상태들 (읽기 전용) */
    Set<RequestStatus> allowedTransitions(RequestStatus from);
}
