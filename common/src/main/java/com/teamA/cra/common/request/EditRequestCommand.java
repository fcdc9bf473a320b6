package com.teamA.cra.common.request;

import com.teamA.cra.common.domain.model.RequestPayload;
import lombok.Builder;

/**
 * 상태 변경 없는 필드 수정
 *
 * markEdited: 제출 이후라면 history에 edited 마커 추가
 * renotify: 현재 상태 기준으로 다음 단계 역할에 다시 알림
 */
@Builder
public record EditRequestCommand(
        RequestPayload payload,
        boolean markEdited,
        boolean renotify
) {
}
