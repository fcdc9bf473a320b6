package com.teamA.cra.worker.integrity;

/**
 * 한 번 실행 결과 (emailReason: 메일을 안 보낸 이유, 보냈으면 null)
 */
public record MonitorResult(int mismatchCount, int inAppInserted, boolean emailQueued, String emailReason) {

    public static MonitorResult clean() {
        return new MonitorResult(0, 0, false, null);
    }
}
