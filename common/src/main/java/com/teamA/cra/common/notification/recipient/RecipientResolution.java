package com.teamA.cra.common.notification.recipient;

import com.teamA.cra.common.domain.enums.Role;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * immediate: 바로 보낼 주소 (outbox)
 * digestRoleGroups: 하루 요약으로 모을 주소 (현재는 admin만)
 */
public record RecipientResolution(List<String> immediate, Map<Role, List<String>> digestRoleGroups) {

    public RecipientResolution {
        immediate = immediate == null ? List.of() : Collections.unmodifiableList(immediate);
        digestRoleGroups = digestRoleGroups == null ? Map.of() : Collections.unmodifiableMap(digestRoleGroups);
    }

    public boolean isEmpty() {
        return immediate.isEmpty() && digestRoleGroups.values().stream().allMatch(List::isEmpty);
    }
}
