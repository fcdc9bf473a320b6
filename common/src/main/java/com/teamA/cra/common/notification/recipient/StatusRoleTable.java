package com.teamA.cra.common.notification.recipient;

import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.enums.Role;
import com.teamA.cra.common.notification.settings.RoleFlags;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 상태 -> 알림 역할 기본 표
 *
 * - in-app은 항상 이 표만 쓴다
 * - 메일은 flowMap[status]가 있으면 그게 우선 (effective)
 * - 표에 없는 상태는 admin만
 */
public final class StatusRoleTable {

    private static final RoleFlags ADMIN_ONLY = RoleFlags.of(Role.ADMIN);

    private static final Map<RequestStatus, RoleFlags> BUILT_IN;

    static {
        Map<RequestStatus, RoleFlags> m = new EnumMap<>(RequestStatus.class);
        m.put(RequestStatus.SUBMITTED, RoleFlags.of(Role.DESIGN, Role.ADMIN));
        m.put(RequestStatus.UNDER_REVIEW, RoleFlags.of(Role.DESIGN, Role.ADMIN));
        m.put(RequestStatus.CLARIFICATION_NEEDED, RoleFlags.of(Role.SALES, Role.ADMIN));
        m.put(RequestStatus.FEASIBILITY_CONFIRMED, RoleFlags.of(Role.COSTING, Role.SALES, Role.ADMIN));
        m.put(RequestStatus.DESIGN_RESULT, RoleFlags.of(Role.COSTING, Role.SALES, Role.ADMIN));
        m.put(RequestStatus.IN_COSTING, RoleFlags.of(Role.COSTING, Role.ADMIN));
        m.put(RequestStatus.COSTING_COMPLETE, RoleFlags.of(Role.SALES, Role.ADMIN));
        m.put(RequestStatus.SALES_FOLLOWUP, RoleFlags.of(Role.SALES, Role.ADMIN));
        m.put(RequestStatus.GM_APPROVAL_PENDING, RoleFlags.of(Role.SALES, Role.ADMIN));
        m.put(RequestStatus.GM_APPROVED, RoleFlags.of(Role.SALES, Role.ADMIN));
        m.put(RequestStatus.GM_REJECTED, RoleFlags.of(Role.SALES, Role.ADMIN));
        m.put(RequestStatus.CLOSED, RoleFlags.of(Role.SALES));
        BUILT_IN = Collections.unmodifiableMap(m);
    }

    private StatusRoleTable() {
    }

    public static RoleFlags builtIn(RequestStatus status) {
        return BUILT_IN.getOrDefault(status, ADMIN_ONLY);
    }

    /** flowMap 우선, 없으면 기본 표 */
    public static RoleFlags effective(Map<RequestStatus, RoleFlags> flowMap, RequestStatus status) {
        if (flowMap != null) {
            RoleFlags override = flowMap.get(status);
            if (override != null) return override;
        }
        return builtIn(status);
    }
}
