package com.teamA.cra.common.domain.enums;

import java.util.Optional;

/**
 * 알림 수신 그룹 (sales / design / costing / admin)
 */
public enum Role {

    SALES("sales"),
    DESIGN("design"),
    COSTING("costing"),
    ADMIN("admin");

    private final String code;

    Role(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<Role> fromCode(String code) {
        if (code == null) return Optional.empty();
        String normalized = code.trim().toLowerCase();
        for (Role role : values()) {
            if (role.code.equals(normalized)) return Optional.of(role);
        }
        return Optional.empty();
    }
}
