package com.teamA.cra.common.notification.template;

import com.teamA.cra.common.domain.enums.NotificationEventType;
import com.teamA.cra.common.domain.enums.NotificationLanguage;

import java.util.EnumMap;
import java.util.Map;

/**
 * 기본 템플릿 (언어 x 이벤트)
 *
 * 없는 이벤트는 request_status_changed 문구를 쓴다.
 */
public final class DefaultEmailTemplates {

    private static final Map<NotificationLanguage, Map<NotificationEventType, EmailTemplate>> DEFAULTS =
            new EnumMap<>(NotificationLanguage.class);

    static {
        String enFooter = "You received this email because you are subscribed to CRA request notifications.";
        DEFAULTS.put(NotificationLanguage.EN, byEvent(
                new EmailTemplate(
                        "[CRA] Request {{requestId}} submitted",
                        "Request {{requestId}}", "", "Open request", "Open dashboard", enFooter),
                new EmailTemplate(
                        "[CRA] Request {{requestId}} status changed to {{status}}",
                        "Request {{requestId}}", "", "Open request", "Open dashboard", enFooter)
        ));

        String frFooter = "Vous recevez cet e-mail car vous etes abonne aux notifications des demandes CRA.";
        DEFAULTS.put(NotificationLanguage.FR, byEvent(
                new EmailTemplate(
                        "[CRA] Demande {{requestId}} soumise",
                        "Demande {{requestId}}", "", "Ouvrir la demande", "Ouvrir le tableau de bord", frFooter),
                new EmailTemplate(
                        "[CRA] Demande {{requestId}} : statut modifie en {{status}}",
                        "Demande {{requestId}}", "", "Ouvrir la demande", "Ouvrir le tableau de bord", frFooter)
        ));

        String zhFooter = "您收到此邮件是因为您订阅了 CRA 请求通知。";
        DEFAULTS.put(NotificationLanguage.ZH, byEvent(
                new EmailTemplate(
                        "[CRA] 请求 {{requestId}} 已提交",
                        "请求 {{requestId}}", "", "打开请求", "打开仪表板", zhFooter),
                new EmailTemplate(
                        "[CRA] 请求 {{requestId}} 状态已变更为 {{status}}",
                        "请求 {{requestId}}", "", "打开请求", "打开仪表板", zhFooter)
        ));
    }

    private DefaultEmailTemplates() {
    }

    public static EmailTemplate forEvent(NotificationEventType eventType, NotificationLanguage lang) {
        Map<NotificationEventType, EmailTemplate> byEvent =
                DEFAULTS.getOrDefault(lang, DEFAULTS.get(NotificationLanguage.BASE));
        EmailTemplate template = byEvent.get(eventType);
        return template != null ? template : byEvent.get(NotificationEventType.REQUEST_STATUS_CHANGED);
    }

    private static Map<NotificationEventType, EmailTemplate> byEvent(EmailTemplate created, EmailTemplate changed) {
        Map<NotificationEventType, EmailTemplate> m = new EnumMap<>(NotificationEventType.class);
        m.put(NotificationEventType.REQUEST_CREATED, created);
        m.put(NotificationEventType.REQUEST_STATUS_CHANGED, changed);
        return m;
    }
}
