package com.teamA.cra.common.notification.settings;

import com.teamA.cra.common.domain.enums.NotificationEventType;
import com.teamA.cra.common.domain.enums.NotificationLanguage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 관리자 템플릿 override (JSON 객체 그대로 보관)
 *
 * 두 가지 모양을 모두 받는다
 * - 언어별: { "en": { "request_created": {...} }, "fr": {...} }
 * - 예전 모양: { "request_created": {...}, "request_status_changed": {...} }  -> 기본 언어(en) 전용
 */
public final class TemplateOverrides {

    public static final TemplateOverrides EMPTY = new TemplateOverrides(Map.of());

    private final Map<String, Object> raw;

    public TemplateOverrides(Map<String, Object> raw) {
        this.raw = raw == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }

    public Map<String, Object> raw() {
        return raw;
    }

    public boolean isEmpty() {
        return raw.isEmpty();
    }

    /**
     * 요청 언어 기준 override
     * - 해당 언어 버킷 안에 eventType이 있으면 그것
     * - 없으면 예전 모양 -> 기본 언어일 때만 최상위 eventType
     */
    public Optional<Map<String, String>> overrideFor(NotificationEventType eventType, NotificationLanguage lang) {
        Object bucket = raw.get(lang.code());
        if (bucket instanceof Map<?, ?> langBucket) {
            Optional<Map<String, String>> keyed = asFieldMap(langBucket.get(eventType.code()));
            if (keyed.isPresent()) return keyed;
        }
        if (lang == NotificationLanguage.BASE) {
            return asFieldMap(raw.get(eventType.code()));
        }
        return Optional.empty();
    }

    private static Optional<Map<String, String>> asFieldMap(Object value) {
        if (!(value instanceof Map<?, ?> m)) return Optional.empty();

        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : m.entrySet()) {
            if (e.getKey() != null && e.getValue() instanceof String s) {
                out.put(e.getKey().toString(), s);
            }
        }
        return Optional.of(out);
    }
}
