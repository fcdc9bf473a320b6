package com.teamA.cra.common.notification.inapp;

import lombok.Builder;

import java.util.Map;
import java.util.UUID;

/**
 * in-app 피드 한 줄. 바뀌는 건 읽음 상태(read, readAt)뿐
 *
 * id = <13자리 createdAt>-<랜덤8> 이라 사전순 = 시간순
 */
@Builder(toBuilder = true)
public record InAppNotification(
        String id,
        String userId,
        String type,
        String title,
        String body,
        String requestId,
        Map<String, Object> payload,
        boolean read,
        long createdAt,
        Long readAt
) {
    public InAppNotification {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
        if (userId == null || userId.isBlank()) throw new IllegalArgumentException("userId is required");
        if (type == null || type.isBlank()) throw new IllegalArgumentException("type is required");
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static String newId(long createdAt) {
        return String.format("%013d-%s", createdAt, UUID.randomUUID().toString().substring(0, 8));
    }
}
