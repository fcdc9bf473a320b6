package com.teamA.cra.common.notification.template;

import java.util.Map;

/**
 * 메일 한 종류의 문구 묶음 ({{변수}} 포함 원문)
 */
public record EmailTemplate(
        String subject,
        String title,
        String intro,
        String primaryButtonText,
        String secondaryButtonText,
        String footerText
) {

    /** override에 있는 문자열 필드만 덮어쓴다 */
    public EmailTemplate mergedWith(Map<String, String> override) {
        if (override == null || override.isEmpty()) return this;
        return new EmailTemplate(
                override.getOrDefault("subject", subject),
                override.getOrDefault("title", title),
                override.getOrDefault("intro", intro),
                override.getOrDefault("primaryButtonText", primaryButtonText),
                override.getOrDefault("secondaryButtonText", secondaryButtonText),
                override.getOrDefault("footerText", footerText)
        );
    }
}
