package com.teamA.cra.common.notification.template;

import com.teamA.cra.common.domain.enums.NotificationLanguage;
import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.model.RequestItem;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 템플릿 치환 변수 ({{requestId}}, {{status}} ...)
 *
 * status / previousStatus 는 언어별 라벨, *Code 는 원래 코드
 */
public final class TemplateVariables {

    private static final DateTimeFormatter UTC_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final Map<String, String> values;
    private final String comment;

    private TemplateVariables(Map<String, String> values, String comment) {
        this.values = Collections.unmodifiableMap(values);
        this.comment = comment == null ? "" : comment.trim();
    }

    public static TemplateVariables of(Map<String, String> values) {
        return new TemplateVariables(new LinkedHashMap<>(values), null);
    }

    public static TemplateVariables forRequest(
            RequestItem request,
            String requestId,
            RequestStatus status,
            RequestStatus previousStatus,
            NotificationLanguage lang,
            String actorName,
            String comment
    ) {
        EmailStrings strings = EmailStrings.forLanguage(lang);
        String statusCode = status == null ? "" : status.code();
        String previousCode = previousStatus == null ? "" : previousStatus.code();

        Map<String, String> v = new LinkedHashMap<>();
        v.put("requestId", text(requestId != null ? requestId : request == null ? null : request.getRequestId()));
        v.put("status", strings.statusLabel(statusCode));
        v.put("statusCode", statusCode);
        v.put("previousStatus", previousCode.isEmpty() ? "" : strings.statusLabel(previousCode));
        v.put("previousStatusCode", previousCode);
        v.put("actor", text(actorName));
        v.put("updatedAt", request == null ? "" : formatUtc(
                request.getUpdatedAt() != null ? request.getUpdatedAt() : request.getCreatedAt()));
        v.put("client", request == null ? "" : text(request.getClientName()));
        v.put("country", request == null ? "" : text(request.attribute("country")));
        v.put("applicationVehicle", request == null ? "" : text(request.attribute("applicationVehicle")));
        v.put("expectedQty", request == null ? "" : number(request.attribute("expectedQty")));
        v.put("expectedDeliveryDate", request == null ? "" : text(request.attribute("clientExpectedDeliveryDate")));

        return new TemplateVariables(v, comment);
    }

    public Map<String, String> asMap() {
        return values;
    }

    public String get(String name) {
        return values.getOrDefault(name, "");
    }

    public String comment() {
        return comment;
    }

    static String formatUtc(Long epochMillis) {
        if (epochMillis == null || epochMillis <= 0) return "";
        return UTC_FORMAT.format(Instant.ofEpochMilli(epochMillis)) + " UTC";
    }

    private static String text(Object value) {
        return value == null ? "" : value.toString().trim();
    }

    // 숫자일 때만 (문자열 수량은 표시 안 함)
    private static String number(Object value) {
        return value instanceof Number n ? n.toString() : "";
    }
}
