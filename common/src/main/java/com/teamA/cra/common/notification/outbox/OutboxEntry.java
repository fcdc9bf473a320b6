package com.teamA.cra.common.notification.outbox;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 즉시 메일 한 통 (SQS 메시지 본문)
 *
 * 외부 sender가 소비 후 삭제한다. 순서 보장 없음.
 */
public record OutboxEntry(
        String id,
        String eventType,
        String requestId,
        List<String> toEmails,
        String subject,
        String bodyHtml
) {
    @JsonCreator
    public OutboxEntry(
            @JsonProperty("id") String id,
            @JsonProperty("eventType") String eventType,
            @JsonProperty("requestId") String requestId,
            @JsonProperty("toEmails") List<String> toEmails,
            @JsonProperty("subject") String subject,
            @JsonProperty("bodyHtml") String bodyHtml
    ) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
        if (eventType == null || eventType.isBlank()) throw new IllegalArgumentException("eventType is required");
        if (toEmails == null || toEmails.isEmpty()) throw new IllegalArgumentException("toEmails is required");
        if (subject == null || subject.isBlank()) throw new IllegalArgumentException("subject is required");
        this.id = id;
        this.eventType = eventType;
        // 무결성 알림처럼 특정 request가 없는 메일도 있다
        this.requestId = requestId == null ? "" : requestId;
        this.toEmails = List.copyOf(toEmails);
        this.subject = subject;
        this.bodyHtml = bodyHtml == null ? "" : bodyHtml;
    }
}
