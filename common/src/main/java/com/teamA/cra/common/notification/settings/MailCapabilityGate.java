package com.teamA.cra.common.notification.settings;

/**
 * 지금 메일을 보낼 수 있는가 (정책 enabled AND 발송 수단 연결)
 */
public interface MailCapabilityGate {

    boolean isMailUsable(NotificationSettings settings);

    /** 사용 불가 사유 (사용 가능하면 null) */
    String unusableReason(NotificationSettings settings);
}
