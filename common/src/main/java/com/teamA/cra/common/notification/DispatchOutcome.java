package com.teamA.cra.common.notification;

/**
 * Dispatcher 결과. 로그가 아니라 이 값으로 결과를 확인한다.
 *
 * skipReason: disabled / not_connected / settings_unavailable / dispatch_failed / no_recipients (정상 처리면 null)
 */
public record DispatchOutcome(
        boolean immediateEmailEnqueued,
        int digestEnqueued,
        int inAppEnqueued,
        String skipReason
) {

    public static final String DISABLED = "disabled";
    public static final String NOT_CONNECTED = "not_connected";
    public static final String SETTINGS_UNAVAILABLE = "settings_unavailable";
    public static final String DISPATCH_FAILED = "dispatch_failed";
    public static final String NOT_DISPATCHED = "not_dispatched";
    public static final String NO_RECIPIENTS = "no_recipients";

    public static DispatchOutcome skipped(String reason) {
        return new DispatchOutcome(false, 0, 0, reason);
    }

    public static DispatchOutcome of(boolean immediateEmailEnqueued, int digestEnqueued, int inAppEnqueued) {
        return new DispatchOutcome(immediateEmailEnqueued, digestEnqueued, inAppEnqueued, null);
    }

    public boolean anythingEnqueued() {
        return immediateEmailEnqueued || digestEnqueued > 0 || inAppEnqueued > 0;
    }
}
