package com.teamA.cra.common.transition;

import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.model.RequestItem;
import com.teamA.cra.common.notification.DispatchOutcome;

import java.util.Set;

/**
 * 상태 전이 결과
 *
 * - Success: 정상 전이 (알림 결과는 참고용, 실패해도 Success)
 * - UnknownStatus: 모르는 상태 코드
 * - IllegalTransition: 규칙표가 거부 (다음 가능 상태 같이 돌려줌)
 * - MissingRequiredField: 코멘트 / BOM 링크 등 필수값 누락
 * - NotFound: request 없음
 * - ConditionFailed: status 불일치 (경쟁/중복 상황, 재시도 후에도 실패)
 *
 * 실패 variant는 모두 "아무것도 쓰지 않았음"을 보장한다.
 */
public sealed interface TransitionResult
        permits TransitionResult.Success,
                TransitionResult.UnknownStatus,
                TransitionResult.IllegalTransition,
                TransitionResult.MissingRequiredField,
                TransitionResult.NotFound,
                TransitionResult.ConditionFailed {

    default boolean isSuccess() {
        return this instanceof Success;
    }

    record Success(
            RequestItem request,
            RequestStatus previousStatus,
            DispatchOutcome notification
    ) implements TransitionResult {}

    record UnknownStatus(String requestedStatus) implements TransitionResult {}

    record IllegalTransition(
            RequestStatus from,
            RequestStatus to,
            Set<RequestStatus> allowed
    ) implements TransitionResult {}

    record MissingRequiredField(String field, String reason) implements TransitionResult {}

    record NotFound(String requestId) implements TransitionResult {}

    record ConditionFailed(String requestId) implements TransitionResult {}
}
