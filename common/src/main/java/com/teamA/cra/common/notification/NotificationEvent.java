package com.teamA.cra.common.notification;

import com.teamA.cra.common.domain.enums.NotificationEventType;
import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.model.RequestItem;
import lombok.Builder;

/**
 * Dispatcher 입력 한 건
 *
 * status는 "알림 기준 상태" (GM 반려면 저장 상태가 아니라 gm_rejected)
 */
@Builder
public record NotificationEvent(
        RequestItem request,
        String requestId,
        NotificationEventType eventType,
        RequestStatus status,
        RequestStatus previousStatus,
        String actorId,
        String actorName,
        String comment
) {
    public NotificationEvent {
        if (requestId == null || requestId.isBlank()) throw new IllegalArgumentException("requestId is required");
        if (eventType == null) throw new IllegalArgumentException("eventType is required");
        if (status == null) throw new IllegalArgumentException("status is required");
    }
}
