package com.teamA.cra.common.domain.enums;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Request 상태 (닫힌 집합)
 *
 * - 저장/전송 시에는 항상 소문자 code 사용 (예: "gm_approval_pending")
 * - EDITED는 history 전용 마커, 전이 대상이 아님
 */
public enum RequestStatus {

    DRAFT("draft"),
    SUBMITTED("submitted"),
    EDITED("edited"),
    UNDER_REVIEW("under_review"),
    CLARIFICATION_NEEDED("clarification_needed"),
    FEASIBILITY_CONFIRMED("feasibility_confirmed"),
    DESIGN_RESULT("design_result"),
    IN_COSTING("in_costing"),
    COSTING_COMPLETE("costing_complete"),
    SALES_FOLLOWUP("sales_followup"),
    GM_APPROVAL_PENDING("gm_approval_pending"),
    GM_APPROVED("gm_approved"),
    GM_REJECTED("gm_rejected"),
    CANCELLED("cancelled"),
    CLOSED("closed");

    private static final Map<String, RequestStatus> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(RequestStatus::code, Function.identity()));

    private final String code;

    RequestStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** 알 수 없는 code면 empty (예외 X) */
    public static Optional<RequestStatus> fromCode(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(BY_CODE.get(code.trim().toLowerCase()));
    }

    @Override
    public String toString() {
        return code;
    }
}
