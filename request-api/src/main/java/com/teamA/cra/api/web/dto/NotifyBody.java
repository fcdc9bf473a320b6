package com.teamA.cra.api.web.dto;

import lombok.Data;

/**
 * 전부 선택. eventType 기본 request_status_changed, status 기본 현재 상태
 */
@Data
public class NotifyBody {
    private String eventType;
    private String status;
    private String previousStatus;
    private String comment;
}
