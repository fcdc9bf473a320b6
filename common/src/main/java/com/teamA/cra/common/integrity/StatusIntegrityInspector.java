package com.teamA.cra.common.integrity;

import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.model.HistoryEntry;
import com.teamA.cra.common.domain.model.RequestItem;
import com.teamA.cra.common.time.Clock;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * 저장된 status 와 history 가 어긋난 request 찾기
 *
 * - mismatch: 마지막(edited 제외) history 상태 != 현재 상태
 *   (history 끝이 gm_rejected 이고 현재가 sales_followup 이면 정상)
 * - 반복 루프: clarification_needed 이후 submitted 가 2번 이상
 */
@RequiredArgsConstructor
public class StatusIntegrityInspector {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 500;

    private final Clock clock;

    public StatusIntegrityReport inspect(Collection<RequestItem> requests, int limit) {
        int maxRows = clampLimit(limit);

        // 최근 수정 순
        List<RequestItem> ordered = new ArrayList<>(requests);
        ordered.sort(Comparator.comparingLong((RequestItem r) -> r.getUpdatedAt() == null ? 0L : r.getUpdatedAt())
                .reversed());

        List<StatusIntegrityReport.StatusMismatch> mismatches = new ArrayList<>();
        List<StatusIntegrityReport.RepeatedSubmitLoop> loops = new ArrayList<>();
        int total = 0;

        for (RequestItem request : ordered) {
            if (request.getRequestId() == null || request.getRequestId().isBlank()) continue;
            total++;

            List<HistoryEntry> history = sortedHistory(request);
            HistoryEntry latest = latestNonEdited(history);
            String current = request.getStatus() == null ? "" : request.getStatus().code();
            String updatedAt = iso(request.getUpdatedAt());

            if (latest != null && !matches(request.getStatus(), latest.status())) {
                mismatches.add(new StatusIntegrityReport.StatusMismatch(
                        request.getRequestId(), current, latest.status().code(), iso(latest.timestamp()), updatedAt));
            }

            int resubmits = submitAfterClarificationCount(history);
            if (resubmits > 1) {
                loops.add(new StatusIntegrityReport.RepeatedSubmitLoop(
                        request.getRequestId(), resubmits, current, updatedAt));
            }
        }

        return new StatusIntegrityReport(
                clock.now().toString(),
                total,
                mismatches.size(),
                loops.size(),
                mismatches.subList(0, Math.min(maxRows, mismatches.size())),
                loops.subList(0, Math.min(maxRows, loops.size()))
        );
    }

    public static int clampLimit(int limit) {
        if (limit < 1) return 1;
        return Math.min(limit, MAX_LIMIT);
    }

    static int submitAfterClarificationCount(List<HistoryEntry> history) {
        boolean clarificationSeen = false;
        int count = 0;
        for (HistoryEntry entry : history) {
            if (entry.status() == RequestStatus.CLARIFICATION_NEEDED) {
                clarificationSeen = true;
            } else if (entry.status() == RequestStatus.SUBMITTED && clarificationSeen) {
                count++;
            }
        }
        return count;
    }

    private static boolean matches(RequestStatus current, RequestStatus latestHistory) {
        if (current == latestHistory) return true;
        return latestHistory == RequestStatus.GM_REJECTED && current == RequestStatus.SALES_FOLLOWUP;
    }

    private static List<HistoryEntry> sortedHistory(RequestItem request) {
        List<HistoryEntry> history = new ArrayList<>();
        for (HistoryEntry entry : request.getHistory()) {
            if (entry.status() != null && entry.timestamp() > 0) history.add(entry);
        }
        // 같은 시각이면 원래 순서 유지 (stable sort)
        history.sort(Comparator.comparingLong(HistoryEntry::timestamp));
        return history;
    }

    private static HistoryEntry latestNonEdited(List<HistoryEntry> history) {
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).status() != RequestStatus.EDITED) return history.get(i);
        }
        return null;
    }

    private static String iso(Long epochMillis) {
        return epochMillis == null || epochMillis <= 0 ? null : Instant.ofEpochMilli(epochMillis).toString();
    }
}
