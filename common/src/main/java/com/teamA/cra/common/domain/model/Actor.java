package com.teamA.cra.common.domain.model;

/**
 * 변경을 일으킨 사용자 (JWT principal 기준)
 */
public record Actor(String id, String name) {

    public Actor {
        id = id == null ? "" : id.trim();
        name = name == null ? "" : name.trim();
    }

    public static Actor system() {
        return new Actor("system", "System");
    }
}
