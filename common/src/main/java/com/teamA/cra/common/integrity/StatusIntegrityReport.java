package com.teamA.cra.common.integrity;

import java.util.List;

/**
 * 상태/히스토리 정합성 점검 결과
 *
 * mismatchCount / repeatedSubmitLoopCount 는 전체 개수, 목록은 limit 까지만
 */
public record StatusIntegrityReport(
        String generatedAt,
        int totalRequests,
        int mismatchCount,
        int repeatedSubmitLoopCount,
        List<StatusMismatch> mismatches,
        List<RepeatedSubmitLoop> repeatedSubmitLoops
) {

    public StatusIntegrityReport {
        mismatches = mismatches == null ? List.of() : List.copyOf(mismatches);
        repeatedSubmitLoops = repeatedSubmitLoops == null ? List.of() : List.copyOf(repeatedSubmitLoops);
    }

    /** generatedAt(UTC ISO)의 날짜 부분 */
    public String snapshotDate() {
        return generatedAt == null || generatedAt.length() < 10 ? "" : generatedAt.substring(0, 10);
    }

    public boolean hasMismatches() {
        return mismatchCount > 0;
    }

    public record StatusMismatch(
            String id,
            String currentStatus,
            String latestHistoryStatus,
            String latestHistoryAt,
            String updatedAt
    ) {
    }

    public record RepeatedSubmitLoop(
            String id,
            int submitAfterClarificationCount,
            String currentStatus,
            String updatedAt
    ) {
    }
}
