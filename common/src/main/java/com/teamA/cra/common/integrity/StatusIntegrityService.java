package com.teamA.cra.common.integrity;

import com.teamA.cra.common.request.RequestStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class StatusIntegrityService {

    private final RequestStore requestStore;
    private final StatusIntegrityInspector inspector;

    public StatusIntegrityReport generateReport(int limit) {
        StatusIntegrityReport report = inspector.inspect(requestStore.findAll(), limit);
        log.info("[INTEGRITY REPORT] total={} mismatches={} repeatedLoops={}",
                report.totalRequests(), report.mismatchCount(), report.repeatedSubmitLoopCount());
        return report;
    }
}
