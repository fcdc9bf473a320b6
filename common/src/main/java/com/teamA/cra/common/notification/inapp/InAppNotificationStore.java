package com.teamA.cra.common.notification.inapp;

import java.util.List;

public interface InAppNotificationStore {

    int MIN_LIMIT = 1;
    int MAX_LIMIT = 100;
    int DEFAULT_LIMIT = 20;

    void insert(InAppNotification notification);

    /**
     * (markerName, markerDate, userId) 조합마다 한 번만 insert
     *
     * @return 이번 호출에서 실제로 썼으면 true
     */
    boolean insertOnce(InAppNotification notification, String markerName, String markerDate);

    /** 최신순, limit은 1..100 으로 보정 */
    List<InAppNotification> list(String userId, boolean unreadOnly, int limit);

    /** 안 읽은 것만 읽음 처리 (이미 읽었거나 없으면 false) */
    boolean markRead(String userId, String notificationId);

    /** @return 이번에 읽음 처리된 개수 */
    int markAllRead(String userId);

    static int clampLimit(int limit) {
        if (limit < MIN_LIMIT) return MIN_LIMIT;
        return Math.min(limit, MAX_LIMIT);
    }
}
