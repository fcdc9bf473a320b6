package com.teamA.cra.common.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Map;

/**
 * 생성/수정 시 들어오는 케이스 필드들.
 * null 필드는 "변경 없음"으로 취급한다.
 */
@Getter
@Builder
public class RequestPayload {

    private final String clientName;
    private final String bomFolderLink;

    @Singular
    private final Map<String, Object> attributes;

    public static RequestPayload empty() {
        return RequestPayload.builder().build();
    }
}
