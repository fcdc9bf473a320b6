package com.teamA.cra.common.notification.language;

import com.teamA.cra.common.domain.enums.NotificationLanguage;
import com.teamA.cra.common.notification.recipient.RecipientDirectory;
import com.teamA.cra.common.notification.settings.EmailAddresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 주소를 선호 언어별로 묶는다 (en, fr, zh 순서 고정)
 *
 * 조회 실패 시 전부 기본 언어 한 그룹 (fail-open)
 */
@Slf4j
@RequiredArgsConstructor
public class LanguageGrouper {

    private final RecipientDirectory directory;

    public List<LanguageGroup> groupByLanguage(Collection<String> addresses) {
        List<String> deduped = EmailAddresses.dedupe(addresses == null ? List.of() : addresses);
        if (deduped.isEmpty()) return List.of();

        Map<String, NotificationLanguage> preferred;
        try {
            preferred = directory.preferredLanguages(deduped);
        } catch (RuntimeException e) {
            log.warn("[LANGUAGE LOOKUP FAILED] {} address(es) fall back to {}",
                    deduped.size(), NotificationLanguage.BASE.code(), e);
            return List.of(new LanguageGroup(NotificationLanguage.BASE, deduped));
        }

        Map<NotificationLanguage, List<String>> byLang = new EnumMap<>(NotificationLanguage.class);
        for (String email : deduped) {
            NotificationLanguage lang = preferred.getOrDefault(email.toLowerCase(), NotificationLanguage.BASE);
            byLang.computeIfAbsent(lang, k -> new ArrayList<>()).add(email);
        }

        // EnumMap 순회 순서 = 선언 순서
        List<LanguageGroup> out = new ArrayList<>();
        for (Map.Entry<NotificationLanguage, List<String>> e : byLang.entrySet()) {
            out.add(new LanguageGroup(e.getKey(), e.getValue()));
        }
        return out;
    }
}
