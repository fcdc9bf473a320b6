package com.teamA.cra.common.transition;

import com.teamA.cra.common.domain.model.Actor;

/**
 * 공통 상태 전이 서비스
 *
 * ❗규칙
 * - status / history 변경은 반드시 이 계층을 통해서만 수행
 * - 검증 실패 시 history는 한 줄도 쓰지 않는다
 * - 알림은 best-effort, 전이 결과를 바꾸지 않는다
 */
public interface StateTransitionService {

    TransitionResult applyTransition(
            String requestId,
            String requestedStatus,
            String comment,
            Actor actor
    );
}
