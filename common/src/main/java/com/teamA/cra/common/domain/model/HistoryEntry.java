package com.teamA.cra.common.domain.model;

import com.teamA.cra.common.domain.enums.RequestStatus;

/**
 * Request history 한 줄 (append-only)
 *
 * timestamp는 epoch millis, 엔진이 부여한다 (호출자가 넣지 않음)
 */
public record HistoryEntry(
        String id,
        RequestStatus status,
        long timestamp,
        String actorId,
        String actorName,
        String comment
) {
    public HistoryEntry {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("history id is required");
        if (status == null) throw new IllegalArgumentException("history status is required");
    }

    public boolean hasComment() {
        return comment != null && !comment.isBlank();
    }
}
