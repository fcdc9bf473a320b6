package com.teamA.cra.common.notification.settings;

import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.enums.Role;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * flowMap JSON ({ "submitted": { "sales": true, ... } }) <-> EnumMap
 *
 * 모르는 상태 키, 객체가 아닌 값은 버린다.
 */
public final class FlowMaps {

    private FlowMaps() {
    }

    public static Map<RequestStatus, RoleFlags> fromRaw(Map<String, ?> raw) {
        Map<RequestStatus, RoleFlags> out = new EnumMap<>(RequestStatus.class);
        if (raw == null) return out;

        for (Map.Entry<String, ?> e : raw.entrySet()) {
            Optional<RequestStatus> status = RequestStatus.fromCode(e.getKey());
            if (status.isEmpty() || !(e.getValue() instanceof Map<?, ?> entry)) continue;

            out.put(status.get(), new RoleFlags(
                    truthy(entry.get(Role.SALES.code())),
                    truthy(entry.get(Role.DESIGN.code())),
                    truthy(entry.get(Role.COSTING.code())),
                    truthy(entry.get(Role.ADMIN.code()))
            ));
        }
        return out;
    }

    public static Map<String, Map<String, Boolean>> toRaw(Map<RequestStatus, RoleFlags> flowMap) {
        Map<String, Map<String, Boolean>> out = new LinkedHashMap<>();
        if (flowMap == null) return out;

        for (Map.Entry<RequestStatus, RoleFlags> e : flowMap.entrySet()) {
            Map<String, Boolean> flags = new LinkedHashMap<>();
            for (Role role : Role.values()) {
                flags.put(role.code(), e.getValue().addresses(role));
            }
            out.put(e.getKey().code(), flags);
        }
        return out;
    }

    private static boolean truthy(Object value) {
        if (value instanceof Boolean b) return b;
        if (value instanceof String s) return Boolean.parseBoolean(s.trim());
        if (value instanceof Number n) return n.intValue() != 0;
        return false;
    }
}
