package com.teamA.cra.common.integrity;

import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.model.HistoryEntry;
import com.teamA.cra.common.domain.model.RequestItem;
import com.teamA.cra.common.support.FixedClock;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StatusIntegrityInspectorTest {

    private final StatusIntegrityInspector inspector =
            new StatusIntegrityInspector(FixedClock.at("2026-10-18T06:00:00Z"));

    private static HistoryEntry h(RequestStatus status, long at) {
        return new HistoryEntry("h-" + status.code() + "-" + at, status, at, "u-1", "User", null);
    }

    private static RequestItem request(String id, RequestStatus status, long updatedAt, HistoryEntry... history) {
        return RequestItem.builder()
                .requestId(id)
                .status(status)
                .updatedAt(updatedAt)
                .history(List.of(history))
                .build();
    }

    @Test
    void shouldFlagStatusThatDisagreesWithLatestHistory() {
        RequestItem broken = request("CRA1", RequestStatus.UNDER_REVIEW, 5000,
                h(RequestStatus.SUBMITTED, 1000), h(RequestStatus.IN_COSTING, 2000));
        RequestItem healthy = request("CRA2", RequestStatus.IN_COSTING, 4000,
                h(RequestStatus.SUBMITTED, 1000), h(RequestStatus.IN_COSTING, 2000), h(RequestStatus.EDITED, 3000));

        StatusIntegrityReport report = inspector.inspect(List.of(broken, healthy), 100);

        assertThat(report.totalRequests()).isEqualTo(2);
        assertThat(report.mismatchCount()).isEqualTo(1);
        assertThat(report.hasMismatches()).isTrue();
        StatusIntegrityReport.StatusMismatch mismatch = report.mismatches().get(0);
        assertThat(mismatch.id()).isEqualTo("CRA1");
        assertThat(mismatch.currentStatus()).isEqualTo("under_review");
        assertThat(mismatch.latestHistoryStatus()).isEqualTo("in_costing");
        assertThat(report.snapshotDate()).isEqualTo("2026-10-18");
    }

    @Test
    void shouldAcceptGmRejectionFollowedBySalesFollowup() {
        RequestItem rejected = request("CRA1", RequestStatus.SALES_FOLLOWUP, 3000,
                h(RequestStatus.GM_APPROVAL_PENDING, 1000), h(RequestStatus.GM_REJECTED, 2000));

        assertThat(inspector.inspect(List.of(rejected), 10).mismatchCount()).isZero();
    }

    @Test
    void shouldOrderHistoryByTimestampBeforeComparing() {
        RequestItem outOfOrder = request("CRA1", RequestStatus.UNDER_REVIEW, 3000,
                h(RequestStatus.UNDER_REVIEW, 2000), h(RequestStatus.SUBMITTED, 1000));

        assertThat(inspector.inspect(List.of(outOfOrder), 10).mismatchCount()).isZero();
    }

    @Test
    void shouldCountRepeatedClarificationResubmits() {
        RequestItem looping = request("CRA1", RequestStatus.SUBMITTED, 9000,
                h(RequestStatus.SUBMITTED, 1000),
                h(RequestStatus.CLARIFICATION_NEEDED, 2000),
                h(RequestStatus.SUBMITTED, 3000),
                h(RequestStatus.CLARIFICATION_NEEDED, 4000),
                h(RequestStatus.SUBMITTED, 5000));
        RequestItem once = request("CRA2", RequestStatus.SUBMITTED, 8000,
                h(RequestStatus.SUBMITTED, 1000),
                h(RequestStatus.CLARIFICATION_NEEDED, 2000),
                h(RequestStatus.SUBMITTED, 3000));

        StatusIntegrityReport report = inspector.inspect(List.of(looping, once), 10);

        assertThat(report.repeatedSubmitLoopCount()).isEqualTo(1);
        assertThat(report.repeatedSubmitLoops()).singleElement().satisfies(loop -> {
            assertThat(loop.id()).isEqualTo("CRA1");
            assertThat(loop.submitAfterClarificationCount()).isEqualTo(2);
        });
    }

    @Test
    void shouldTruncateListsButKeepFullCounts() {
        List<RequestItem> requests = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            requests.add(request("CRA" + i, RequestStatus.CLOSED, i * 1000L, h(RequestStatus.SUBMITTED, 10)));
        }

        StatusIntegrityReport report = inspector.inspect(requests, 2);

        assertThat(report.mismatchCount()).isEqualTo(5);
        assertThat(report.mismatches()).extracting(StatusIntegrityReport.StatusMismatch::id)
                .containsExactly("CRA5", "CRA4");
    }

    @Test
    void shouldClampLimit() {
        assertThat(StatusIntegrityInspector.clampLimit(0)).isEqualTo(1);
        assertThat(StatusIntegrityInspector.clampLimit(10_000)).isEqualTo(StatusIntegrityInspector.MAX_LIMIT);
    }
}
