package com.teamA.cra.common.notification.digest;

import com.teamA.cra.common.domain.enums.NotificationEventType;
import com.teamA.cra.common.domain.enums.NotificationLanguage;
import com.teamA.cra.common.domain.enums.RequestStatus;
import lombok.Builder;

import java.util.List;

/**
 * digest 큐 한 줄. (digestDate, lang) 단위로 쌓이고 외부 발송기가 하루 한 번 묶어 보낸다.
 *
 * previousStatus 는 생성 이벤트면 null
 */
@Builder
public record DigestQueueEntry(
        String id,
        NotificationEventType eventType,
        String requestId,
        RequestStatus status,
        RequestStatus previousStatus,
        String actorName,
        String comment,
        List<String> toEmails,
        NotificationLanguage lang,
        String digestDate,
        long eventAt
) {
    public DigestQueueEntry {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
        if (requestId == null || requestId.isBlank()) throw new IllegalArgumentException("requestId is required");
        if (eventType == null) throw new IllegalArgumentException("eventType is required");
        if (status == null) throw new IllegalArgumentException("status is required");
        if (digestDate == null || digestDate.isBlank()) throw new IllegalArgumentException("digestDate is required");
        if (toEmails == null || toEmails.isEmpty()) throw new IllegalArgumentException("toEmails is required");
        toEmails = List.copyOf(toEmails);
        lang = lang == null ? NotificationLanguage.BASE : lang;
    }
}
