package com.teamA.cra.common.domain.enums;

import java.util.Optional;

public enum NotificationEventType {

    REQUEST_CREATED("request_created"),
    REQUEST_STATUS_CHANGED("request_status_changed"),
    STATUS_INTEGRITY_ALERT("status_integrity_alert");

    private final String code;

    NotificationEventType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<NotificationEventType> fromCode(String code) {
        if (code == null) return Optional.empty();
        String normalized = code.trim().toLowerCase();
        for (NotificationEventType type : values()) {
            if (type.code.equals(normalized)) return Optional.of(type);
        }
        return Optional.empty();
    }
}
