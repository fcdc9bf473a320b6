package com.teamA.cra.common.notification.settings;

import com.teamA.cra.common.domain.enums.Role;

import java.util.EnumSet;
import java.util.Set;

/**
 * 상태 하나에 대해 어떤 역할을 부를지 (flowMap 한 칸 / 기본 표 한 줄)
 */
public record RoleFlags(boolean sales, boolean design, boolean costing, boolean admin) {

    public static final RoleFlags NONE = new RoleFlags(false, false, false, false);

    public static RoleFlags of(Role... roles) {
        Set<Role> set = roles.length == 0 ? EnumSet.noneOf(Role.class) : EnumSet.of(roles[0], roles);
        return new RoleFlags(
                set.contains(Role.SALES),
                set.contains(Role.DESIGN),
                set.contains(Role.COSTING),
                set.contains(Role.ADMIN)
        );
    }

    public boolean addresses(Role role) {
        return switch (role) {
            case SALES -> sales;
            case DESIGN -> design;
            case COSTING -> costing;
            case ADMIN -> admin;
        };
    }

    /** 선언 순서(sales, design, costing, admin) */
    public Set<Role> roles() {
        Set<Role> out = EnumSet.noneOf(Role.class);
        for (Role role : Role.values()) {
            if (addresses(role)) out.add(role);
        }
        return out;
    }
}
