package com.teamA.cra.common.transition;

import com.teamA.cra.common.domain.enums.RequestStatus;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.teamA.cra.common.domain.enums.RequestStatus.*;

/**
 * 기본 상태머신 "허용 전이" 표.
 * - UpdateItem 수행 로직은 여기 넣지 않는다.
 * - EDITED는 history 마커라서 어느 쪽에도 오지 않는다.
 */
public final class StatusTransitionRules implements TransitionLegality {

    private static final Map<RequestStatus, Set<RequestStatus>> ALLOWED = new EnumMap<>(RequestStatus.class);

    static {
        ALLOWED.put(DRAFT, EnumSet.of(SUBMITTED, CANCELLED));
        ALLOWED.put(SUBMITTED, EnumSet.of(UNDER_REVIEW, CLARIFICATION_NEEDED, CANCELLED));
        ALLOWED.put(UNDER_REVIEW, EnumSet.of(FEASIBILITY_CONFIRMED, DESIGN_RESULT, CLARIFICATION_NEEDED, CANCELLED));
        ALLOWED.put(CLARIFICATION_NEEDED, EnumSet.of(SUBMITTED, CANCELLED));
        ALLOWED.put(FEASIBILITY_CONFIRMED, EnumSet.of(DESIGN_RESULT, IN_COSTING, CANCELLED));
        ALLOWED.put(DESIGN_RESULT, EnumSet.of(IN_COSTING, COSTING_COMPLETE, CANCELLED));
        ALLOWED.put(IN_COSTING, EnumSet.of(COSTING_COMPLETE, CLARIFICATION_NEEDED, CANCELLED));
        ALLOWED.put(COSTING_COMPLETE, EnumSet.of(SALES_FOLLOWUP, GM_APPROVAL_PENDING, CANCELLED, CLOSED));
        ALLOWED.put(SALES_FOLLOWUP, EnumSet.of(GM_APPROVAL_PENDING, GM_APPROVED, CANCELLED, CLOSED));
        ALLOWED.put(GM_APPROVAL_PENDING, EnumSet.of(GM_APPROVED, GM_REJECTED, CANCELLED));
        ALLOWED.put(GM_APPROVED, EnumSet.of(CLOSED));
        ALLOWED.put(GM_REJECTED, EnumSet.of(SALES_FOLLOWUP, GM_APPROVAL_PENDING, CANCELLED));

        // 최종 상태는 추가 전이 없음
        ALLOWED.put(CLOSED, EnumSet.noneOf(RequestStatus.class));
        ALLOWED.put(CANCELLED, EnumSet.noneOf(RequestStatus.class));
    }

    @Override
    public boolean isKnownStatus(String status) {
        return RequestStatus.fromCode(status)
                .filter(s -> s != EDITED)
                .isPresent();
    }

    /** from -> to 전이가 허용되는지 (같은 상태 재지정은 허용) */
    @Override
    public boolean isAllowedTransition(RequestStatus from, RequestStatus to) {
        if (from == null || to == null) return false;
        if (from == EDITED || to == EDITED) return false;
        if (from == to) return true;
        Set<RequestStatus> next = ALLOWED.get(from);
        return next != null && next.contains(to);
    }

    @Override
    public Set<RequestStatus> allowedTransitions(RequestStatus from) {
        if (from == null) return Set.of();
        Set<RequestStatus> next = ALLOWED.get(from);
        return next == null ? Set.of() : Set.copyOf(next);
    }
}
