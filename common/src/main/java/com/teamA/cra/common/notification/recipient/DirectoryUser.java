package com.teamA.cra.common.notification.recipient;

import com.teamA.cra.common.domain.enums.NotificationLanguage;
import com.teamA.cra.common.domain.enums.Role;

public record DirectoryUser(
        String userId,
        String email,
        String name,
        Role role,
        NotificationLanguage preferredLanguage,
        boolean active
) {
}
