package com.teamA.cra.api.web.dto;

import com.teamA.cra.common.domain.model.HistoryEntry;
import com.teamA.cra.common.domain.model.RequestItem;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter @Builder
public class RequestResponse {
    private String requestId;
    private String status;
    private String createdBy;
    private String createdByName;
    private String draftSessionKey;
    private String clientName;
    private String bomFolderLink;
    private Map<String, Object> attributes;
    private Timestamps timestamps;
    private List<History> history;

    @Getter @Builder
    public static class Timestamps {
        private Long createdAt;
        private Long updatedAt;
    }

    public record History(
            String id,
            String status,
            long timestamp,
            String actorId,
            String actorName,
            String comment
    ) {
        static History from(HistoryEntry entry) {
            return new History(entry.id(), entry.status().code(), entry.timestamp(),
                    entry.actorId(), entry.actorName(), entry.comment());
        }
    }

    public static RequestResponse from(RequestItem item) {
        return RequestResponse.builder()
                .requestId(item.getRequestId())
                .status(item.getStatus() == null ? null : item.getStatus().code())
                .createdBy(item.getCreatedBy())
                .createdByName(item.getCreatedByName())
                .draftSessionKey(item.getDraftSessionKey())
                .clientName(item.getClientName())
                .bomFolderLink(item.getBomFolderLink())
                .attributes(item.getAttributes())
                .timestamps(Timestamps.builder()
                        .createdAt(item.getCreatedAt())
                        .updatedAt(item.getUpdatedAt())
                        .build())
                .history(item.getHistory().stream().map(History::from).toList())
                .build();
    }
}
