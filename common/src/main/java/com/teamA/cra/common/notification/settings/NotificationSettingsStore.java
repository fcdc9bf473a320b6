package com.teamA.cra.common.notification.settings;

public interface NotificationSettingsStore {

    /** 저장된 값이 없으면 disabled 기본값 */
    NotificationSettings load();

    void save(NotificationSettings settings);
}
