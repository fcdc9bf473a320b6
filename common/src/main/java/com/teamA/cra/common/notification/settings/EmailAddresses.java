package com.teamA.cra.common.notification.settings;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 관리자가 붙여넣는 주소 목록 파싱 (콤마 / 세미콜론 / 줄바꿈)
 *
 * 대소문자 무시 중복 제거, 처음 나온 표기를 유지한다.
 */
public final class EmailAddresses {

    private static final Pattern SEPARATORS = Pattern.compile("[;,\\n]");

    private EmailAddresses() {
    }

    public static List<String> parse(String raw) {
        if (raw == null || raw.isBlank()) return List.of();

        List<String> tokens = new ArrayList<>();
        for (String token : SEPARATORS.split(raw.trim())) {
            String v = token.trim();
            if (!v.isEmpty()) tokens.add(v);
        }
        return dedupe(tokens);
    }

    public static List<String> dedupe(Collection<String> addresses) {
        Set<String> seen = new HashSet<>();
        List<String> out = new ArrayList<>();
        for (String raw : addresses) {
            if (raw == null) continue;
            String email = raw.trim();
            if (email.isEmpty()) continue;
            if (seen.add(email.toLowerCase())) {
                out.add(email);
            }
        }
        return out;
    }
}
