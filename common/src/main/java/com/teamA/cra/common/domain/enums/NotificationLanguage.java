package com.teamA.cra.common.domain.enums;

import java.util.Optional;

/**
 * 알림 언어. 선언 순서 = 그룹 출력 순서 (en, fr, zh)
 */
public enum NotificationLanguage {

    EN("en"),
    FR("fr"),
    ZH("zh");

    /** 선호 언어를 모르면 항상 여기로 떨어진다 */
    public static final NotificationLanguage BASE = EN;

    private final String code;

    NotificationLanguage(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<NotificationLanguage> fromCode(String code) {
        if (code == null) return Optional.empty();
        String normalized = code.trim().toLowerCase();
        for (NotificationLanguage lang : values()) {
            if (lang.code.equals(normalized)) return Optional.of(lang);
        }
        return Optional.empty();
    }

    public static NotificationLanguage fromCodeOrBase(String code) {
        return fromCode(code).orElse(BASE);
    }
}
