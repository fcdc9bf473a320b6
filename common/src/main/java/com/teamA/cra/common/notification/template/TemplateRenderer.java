package com.teamA.cra.common.notification.template;

import com.teamA.cra.common.domain.enums.NotificationEventType;
import com.teamA.cra.common.domain.enums.NotificationLanguage;
import com.teamA.cra.common.notification.settings.NotificationSettings;
import org.springframework.web.util.HtmlUtils;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * (설정, 이벤트, 언어, 변수) -> 제목 + HTML 본문
 *
 * 템플릿 우선순위: 언어별 override > 예전 모양 override(en만) > 언어 기본값 > en 기본값
 * 치환은 한 번만 ({{x}} 값 안의 {{y}}는 다시 치환하지 않음), 모르는 변수는 빈 문자열
 */
public class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([^{}\\s]+)\\s*}}");

    private static final String ACCENT = "#D71920";

    public EmailTemplate resolveTemplate(NotificationSettings settings, NotificationEventType eventType, NotificationLanguage lang) {
        EmailTemplate base = DefaultEmailTemplates.forEvent(eventType, lang);
        if (settings == null) return base;

        return settings.getTemplates()
                .overrideFor(eventType, lang)
                .map(base::mergedWith)
                .orElse(base);
    }

    public RenderedEmail render(
            NotificationSettings settings,
            NotificationEventType eventType,
            NotificationLanguage lang,
            TemplateVariables vars
    ) {
        NotificationLanguage language = lang == null ? NotificationLanguage.BASE : lang;
        EmailTemplate template = resolveTemplate(settings, eventType, language);
        EmailStrings strings = EmailStrings.forLanguage(language);

        String subject = apply(template.subject(), vars.asMap()).trim();
        if (subject.isEmpty()) {
            subject = apply(DefaultEmailTemplates.forEvent(eventType, language).subject(), vars.asMap()).trim();
        }
        if (subject.isEmpty()) {
            subject = "[CRA] Request " + vars.get("requestId") + " updated";
        }

        String appBaseUrl = settings == null ? null : settings.getAppBaseUrl();
        String html = renderHtml(eventType, language, template, strings, vars,
                requestLink(appBaseUrl, vars.get("requestId")), dashboardLink(appBaseUrl));

        return new RenderedEmail(subject, html);
    }

    /** {{name}} -> 값, 모르는 이름이면 "" (단일 패스, 어떤 placeholder도 출력에 남지 않음) */
    public static String apply(String template, Map<String, String> vars) {
        if (template == null || template.isEmpty()) return "";

        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        while (m.find()) {
            String value = vars.get(m.group(1));
            m.appendReplacement(out, Matcher.quoteReplacement(value == null ? "" : value));
        }
        m.appendTail(out);
        return out.toString();
    }

    public static String requestLink(String appBaseUrl, String requestId) {
        String base = trimBase(appBaseUrl);
        if (base.isEmpty() || requestId == null || requestId.isEmpty()) return "";
        return base + "/requests/" + UriUtils.encodePathSegment(requestId, StandardCharsets.UTF_8);
    }

    public static String dashboardLink(String appBaseUrl) {
        String base = trimBase(appBaseUrl);
        return base.isEmpty() ? "" : base + "/dashboard";
    }

    private static String trimBase(String appBaseUrl) {
        return appBaseUrl == null ? "" : appBaseUrl.trim().replaceAll("/+$", "");
    }

    private String renderHtml(
            NotificationEventType eventType,
            NotificationLanguage lang,
            EmailTemplate template,
            EmailStrings strings,
            TemplateVariables vars,
            String requestLink,
            String dashboardLink
    ) {
        Map<String, String> v = vars.asMap();
        boolean statusChanged = eventType == NotificationEventType.REQUEST_STATUS_CHANGED;

        String title = orDefault(apply(template.title(), v), "Request Update");
        String intro = apply(template.intro(), v).trim();
        String primary = orDefault(apply(template.primaryButtonText(), v), "Open request");
        String secondary = apply(template.secondaryButtonText(), v).trim();
        String footer = orDefault(apply(template.footerText(), v), strings.footerFallback());

        String statusLabel = orDefault(vars.get("status"), strings.statusUpdatedLabel());
        String previousCode = vars.get("previousStatusCode");

        StringBuilder html = new StringBuilder(2048);
        html.append("<!doctype html><html lang=\"").append(esc(lang.code())).append("\">")
                .append("<head><meta charset=\"utf-8\" /></head>")
                .append("<body style=\"margin:0; padding:0; background:#F5F7FB; color:#111827; font-family:Arial, sans-serif;\">")
                .append("<table role=\"presentation\" width=\"100%\" cellpadding=\"0\" cellspacing=\"0\" border=\"0\">")
                .append("<tr><td align=\"center\" style=\"padding:30px 12px;\">")
                .append("<table role=\"presentation\" width=\"640\" cellpadding=\"0\" cellspacing=\"0\" border=\"0\" style=\"background:#FFFFFF; border:1px solid #E5E7EB;\">");

        // 헤더
        html.append("<tr><td style=\"padding:12px 24px; font-size:12px; color:#6B7280;\">")
                .append(esc(strings.notificationLabel()))
                .append(" | ")
                .append(esc(statusChanged ? strings.statusUpdatedLabel() : strings.requestCreatedLabel()))
                .append("</td></tr>");

        html.append("<tr><td style=\"padding:22px 24px 18px 24px;\">")
                .append("<div style=\"font-size:20px; font-weight:900;\">").append(esc(title)).append("</div>");
        if (statusChanged) {
            html.append("<div style=\"margin-top:10px; font-size:22px; font-weight:900; color:").append(ACCENT)
                    .append("; text-transform:uppercase;\">").append(esc(statusLabel)).append("</div>");
            if (!previousCode.isEmpty() && !previousCode.equals(vars.get("statusCode"))) {
                html.append("<div style=\"margin-top:8px; font-size:12px; color:#374151;\">")
                        .append(esc(vars.get("previousStatus"))).append(" &rarr; ").append(esc(statusLabel))
                        .append("</div>");
            }
        }
        if (!intro.isEmpty()) {
            html.append("<div style=\"margin-top:10px; font-size:14px; color:#374151;\">").append(esc(intro)).append("</div>");
        }
        String meta = metaLine(strings, vars);
        if (!meta.isEmpty()) {
            html.append("<div style=\"margin-top:10px; font-size:12px; color:#6B7280;\">").append(meta).append("</div>");
        }
        html.append("</td></tr>");

        // 케이스 요약 (값 있는 것만, 두 칸씩)
        List<String> facts = new ArrayList<>();
        addFact(facts, strings.clientLabel(), vars.get("client"));
        addFact(facts, strings.countryLabel(), vars.get("country"));
        addFact(facts, strings.applicationVehicleLabel(), vars.get("applicationVehicle"));
        addFact(facts, strings.expectedQtyLabel(), vars.get("expectedQty"));
        addFact(facts, strings.expectedDeliveryDateLabel(), vars.get("expectedDeliveryDate"));
        if (!facts.isEmpty()) {
            html.append("<tr><td style=\"padding:0 24px;\"><table role=\"presentation\" width=\"100%\">");
            for (int i = 0; i < facts.size(); i += 2) {
                String right = i + 1 < facts.size() ? facts.get(i + 1) : "<td width=\"50%\">&nbsp;</td>";
                html.append("<tr>").append(facts.get(i)).append(right).append("</tr>");
            }
            html.append("</table></td></tr>");
        }

        if (!vars.comment().isEmpty()) {
            html.append("<tr><td style=\"padding:14px 24px 0 24px;\">")
                    .append("<div style=\"font-size:11px; color:#6B7280; text-transform:uppercase;\">")
                    .append(esc(strings.commentLabel())).append("</div>")
                    .append("<div style=\"margin-top:8px; padding:10px 12px; background:#F9FAFB; border-left:4px solid ")
                    .append(ACCENT).append("; white-space:pre-wrap;\">").append(esc(vars.comment())).append("</div>")
                    .append("</td></tr>");
        }

        // 버튼 (링크 없으면 생략)
        html.append("<tr><td align=\"center\" style=\"padding:18px 24px 22px 24px;\">");
        if (!requestLink.isEmpty()) {
            html.append(button(requestLink, primary, ACCENT, "#FFFFFF"));
        }
        if (!dashboardLink.isEmpty() && !secondary.isEmpty()) {
            html.append(button(dashboardLink, secondary, "#FFFFFF", "#0F172A"));
        }
        if (!requestLink.isEmpty()) {
            html.append("<div style=\"margin-top:14px; font-size:11px; color:#6B7280;\">")
                    .append(esc(strings.linkFallbackPrefix())).append(" <a href=\"").append(esc(requestLink)).append("\">")
                    .append(esc(requestLink)).append("</a></div>");
        }
        html.append("</td></tr>");

        html.append("</table>")
                .append("<div style=\"padding:14px 6px 0 6px; font-size:11px; color:#6B7280;\">").append(esc(footer)).append("</div>")
                .append("</td></tr></table></body></html>");

        return html.toString();
    }

    /** 무결성 알림 메일 (관리자 전용, 영문 고정) */
    public RenderedEmail renderIntegrityAlert(String appBaseUrl, String snapshotDate, int mismatchCount, int repeatedLoopCount) {
        String base = trimBase(appBaseUrl);
        String link = base.isEmpty() ? "" : base + "/settings?tab=deployments";

        StringBuilder html = new StringBuilder(512);
        html.append("<div style=\"font-family:Segoe UI,Arial,sans-serif;color:#111827\">")
                .append("<h2 style=\"margin:0 0 8px 0;\">Request status integrity alert</h2>")
                .append("<p style=\"margin:0 0 8px 0;\">Snapshot date: <strong>").append(esc(snapshotDate)).append("</strong></p>")
                .append("<p style=\"margin:0 0 8px 0;\">Mismatches found: <strong>").append(mismatchCount).append("</strong></p>")
                .append("<p style=\"margin:0 0 8px 0;\">Repeated clarification resubmits: <strong>")
                .append(repeatedLoopCount).append("</strong></p>");
        if (!link.isEmpty()) {
            html.append("<p><a href=\"").append(esc(link)).append("\">Open deployment diagnostics</a></p>");
        }
        html.append("</div>");

        return new RenderedEmail("[CRA] Status integrity alert (" + mismatchCount + ")", html.toString());
    }

    private static String metaLine(EmailStrings strings, TemplateVariables vars) {
        List<String> parts = new ArrayList<>();
        if (!vars.get("requestId").isEmpty()) parts.add(esc(strings.metaRequestPrefix() + " " + vars.get("requestId")));
        if (!vars.get("updatedAt").isEmpty()) parts.add(esc(vars.get("updatedAt")));
        if (!vars.get("actor").isEmpty()) parts.add(esc(strings.metaByPrefix() + " " + vars.get("actor")));
        return String.join(" | ", parts);
    }

    private static void addFact(List<String> facts, String label, String value) {
        if (value == null || value.isBlank()) return;
        facts.add("<td width=\"50%\" valign=\"top\" style=\"padding:10px 10px 10px 0;\">"
                + "<div style=\"font-size:11px; color:#6B7280; text-transform:uppercase;\">" + esc(label) + "</div>"
                + "<div style=\"margin-top:3px; font-size:14px; font-weight:700;\">" + esc(value.trim()) + "</div></td>");
    }

    private static String button(String href, String text, String background, String color) {
        return "<table role=\"presentation\" align=\"center\" width=\"440\" style=\"margin:0 auto 10px auto;\"><tr>"
                + "<td align=\"center\" bgcolor=\"" + background + "\" style=\"background:" + background
                + "; border:1px solid #CBD5E1; border-radius:12px;\">"
                + "<a href=\"" + esc(href) + "\" style=\"display:block; padding:14px 18px; font-size:15px; font-weight:800; color:"
                + color + "; text-decoration:none;\">" + esc(text) + "</a></td></tr></table>";
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static String esc(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value, StandardCharsets.UTF_8.name());
    }
}
