package com.teamA.cra.common.request;

import com.teamA.cra.common.domain.model.RequestPayload;
import lombok.Builder;

/**
 * status가 비어 있으면 draft로 생성
 */
@Builder
public record CreateRequestCommand(
        String status,
        String draftSessionKey,
        RequestPayload payload
) {
}
