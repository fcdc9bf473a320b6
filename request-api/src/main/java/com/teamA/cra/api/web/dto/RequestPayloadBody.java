package com.teamA.cra.api.web.dto;

import com.teamA.cra.common.domain.model.RequestPayload;
import lombok.Data;

import java.util.Map;

/**
 * 생성/수정 공통 케이스 필드 (null = 변경 없음)
 */
@Data
public class RequestPayloadBody {
    private String clientName;
    private String bomFolderLink;
    private Map<String, Object> attributes;

    public RequestPayload toPayload() {
        RequestPayload.RequestPayloadBuilder builder = RequestPayload.builder()
                .clientName(clientName)
                .bomFolderLink(bomFolderLink);
        if (attributes != null) {
            // null 값은 @Singular 빌더에 넣을 수 없어서 제외
            attributes.forEach((k, v) -> {
                if (k != null && v != null) builder.attribute(k, v);
            });
        }
        return builder.build();
    }
}
