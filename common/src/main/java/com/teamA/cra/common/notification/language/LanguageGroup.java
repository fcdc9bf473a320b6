package com.teamA.cra.common.notification.language;

import com.teamA.cra.common.domain.enums.NotificationLanguage;

import java.util.List;

public record LanguageGroup(NotificationLanguage language, List<String> addresses) {

    public LanguageGroup {
        addresses = List.copyOf(addresses);
    }
}
