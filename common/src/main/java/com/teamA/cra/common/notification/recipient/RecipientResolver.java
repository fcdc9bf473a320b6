package com.teamA.cra.common.notification.recipient;

import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.enums.Role;
import com.teamA.cra.common.notification.settings.EmailAddresses;
import com.teamA.cra.common.notification.settings.NotificationSettings;
import com.teamA.cra.common.notification.settings.RoleFlags;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * (설정, 상태) -> 메일 수신자
 *
 * admin은 긴급 상태(기본: gm_approval_pending)에서만 즉시 메일, 나머지는 digest
 */
public class RecipientResolver {

    private final Set<RequestStatus> urgentStatuses;

    public RecipientResolver(Set<RequestStatus> urgentStatuses) {
        this.urgentStatuses = urgentStatuses == null || urgentStatuses.isEmpty()
                ? EnumSet.noneOf(RequestStatus.class)
                : EnumSet.copyOf(urgentStatuses);
    }

    public static RecipientResolver withDefaultUrgency() {
        return new RecipientResolver(EnumSet.of(RequestStatus.GM_APPROVAL_PENDING));
    }

    public boolean isUrgent(RequestStatus status) {
        return urgentStatuses.contains(status);
    }

    public RecipientResolution resolve(NotificationSettings settings, RequestStatus status) {
        RoleFlags flags = StatusRoleTable.effective(settings.getFlowMap(), status);

        List<String> immediate = new ArrayList<>();
        Map<Role, List<String>> digest = new EnumMap<>(Role.class);

        for (Role role : flags.roles()) {
            // test 모드: 실제 목록 대신 test 주소로
            List<String> addresses = settings.isTestMode()
                    ? settings.testRecipients()
                    : settings.recipientsFor(role);
            if (addresses.isEmpty()) continue;

            if (role == Role.ADMIN && !isUrgent(status)) {
                digest.put(role, EmailAddresses.dedupe(addresses));
            } else {
                immediate.addAll(addresses);
            }
        }

        return new RecipientResolution(EmailAddresses.dedupe(immediate), digest);
    }
}
