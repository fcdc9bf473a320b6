package com.teamA.cra.worker.integrity;

import com.teamA.cra.common.domain.enums.NotificationEventType;
import com.teamA.cra.common.domain.enums.Role;
import com.teamA.cra.common.integrity.StatusIntegrityReport;
import com.teamA.cra.common.integrity.StatusIntegrityService;
import com.teamA.cra.common.marker.DailyMarkerStore;
import com.teamA.cra.common.notification.inapp.InAppNotification;
import com.teamA.cra.common.notification.inapp.InAppNotificationStore;
import com.teamA.cra.common.notification.outbox.OutboxEntry;
import com.teamA.cra.common.notification.outbox.OutboxPublisher;
import com.teamA.cra.common.notification.recipient.DirectoryUser;
import com.teamA.cra.common.notification.recipient.RecipientDirectory;
import com.teamA.cra.common.notification.settings.MailCapabilityGate;
import com.teamA.cra.common.notification.settings.NotificationSettings;
import com.teamA.cra.common.notification.settings.NotificationSettingsStore;
import com.teamA.cra.common.notification.template.RenderedEmail;
import com.teamA.cra.common.notification.template.TemplateRenderer;
import com.teamA.cra.common.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 하루 한 번 status/history 정합성 점검
 *
 * mismatch 가 있으면
 * - 활성 admin 마다 in-app 알림 1건 (snapshotDate 당 1번)
 * - admin 수신자에게 메일 1통 (하루 1번, 메일 사용 가능할 때만)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatusIntegrityMonitor {

    static final int REPORT_LIMIT = 50;
    static final String ALERT_TITLE = "Request status integrity alert";
    static final String ACTION_PATH = "/settings?tab=deployments";
    static final String IN_APP_MARKER = "integrity_alert_inapp";
    static final String EMAIL_MARKER = "integrity_alert_email";

    private final StatusIntegrityService statusIntegrityService;
    private final RecipientDirectory recipientDirectory;
    private final InAppNotificationStore inAppNotificationStore;
    private final NotificationSettingsStore settingsStore;
    private final MailCapabilityGate mailCapabilityGate;
    private final TemplateRenderer templateRenderer;
    private final OutboxPublisher outboxPublisher;
    private final DailyMarkerStore dailyMarkerStore;
    private final Clock clock;

    @Value("${integrity.monitor.run-on-startup:true}")
    private boolean runOnStartup;

    // 실행 중 중복 진입 방지
    private final AtomicBoolean running = new AtomicBoolean(false);

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (runOnStartup) {
            tick();
        }
    }

    @Scheduled(cron = "${integrity.monitor.cron:0 0 6 * * *}", zone = "${integrity.monitor.zone:UTC}")
    public void tick() {
        if (!running.compareAndSet(false, true)) {
            log.info("[INTEGRITY MONITOR] previous run still in progress, skipped");
            return;
        }
        try {
            check();
        } catch (RuntimeException e) {
            log.error("[INTEGRITY MONITOR] run failed", e);
        } finally {
            running.set(false);
        }
    }

    public MonitorResult check() {
        StatusIntegrityReport report = statusIntegrityService.generateReport(REPORT_LIMIT);
        if (!report.hasMismatches()) {
            log.info("[INTEGRITY MONITOR] clean total={}", report.totalRequests());
            return MonitorResult.clean();
        }

        int inserted = enqueueInAppAlerts(report);
        EmailAttempt email = enqueueEmailAlert(report);

        log.warn("[INTEGRITY ALERT] mismatches={} repeatedLoops={} inAppInserted={} emailQueued={} emailReason={}",
                report.mismatchCount(), report.repeatedSubmitLoopCount(), inserted, email.queued(), email.reason());
        return new MonitorResult(report.mismatchCount(), inserted, email.queued(), email.reason());
    }

    private int enqueueInAppAlerts(StatusIntegrityReport report) {
        List<DirectoryUser> admins;
        try {
            admins = recipientDirectory.findActiveUsersByRole(Role.ADMIN);
        } catch (RuntimeException e) {
            log.warn("[INTEGRITY ALERT] admin lookup failed, in-app alerts skipped", e);
            return 0;
        }

        long now = clock.nowMillis();
        String body = report.mismatchCount() + " request(s) have status/history mismatches.";
        int inserted = 0;
        for (DirectoryUser admin : admins) {
            if (!admin.active()) continue;
            InAppNotification notification = InAppNotification.builder()
                    .id(InAppNotification.newId(now))
                    .userId(admin.userId())
                    .type(NotificationEventType.STATUS_INTEGRITY_ALERT.code())
                    .title(ALERT_TITLE)
                    .body(body)
                    .payload(alertPayload(report))
                    .read(false)
                    .createdAt(now)
                    .build();
            try {
                if (inAppNotificationStore.insertOnce(notification, IN_APP_MARKER, report.snapshotDate())) {
                    inserted++;
                }
            } catch (RuntimeException e) {
                log.warn("[INTEGRITY ALERT] in-app insert failed userId={}", admin.userId(), e);
            }
        }
        return inserted;
    }

    private EmailAttempt enqueueEmailAlert(StatusIntegrityReport report) {
        NotificationSettings settings;
        try {
            settings = settingsStore.load();
        } catch (RuntimeException e) {
            log.warn("[INTEGRITY ALERT] settings unavailable", e);
            return new EmailAttempt(false, "settings_unavailable");
        }
        if (!mailCapabilityGate.isMailUsable(settings)) {
            return new EmailAttempt(false, "email_disabled_or_disconnected");
        }

        List<String> recipients = settings.recipientsFor(Role.ADMIN);
        if (recipients.isEmpty()) {
            return new EmailAttempt(false, "no_admin_recipients");
        }

        String today = clock.now().toString().substring(0, 10);
        if (!dailyMarkerStore.tryMark(EMAIL_MARKER, today)) {
            return new EmailAttempt(false, "already_queued_today");
        }

        RenderedEmail email = templateRenderer.renderIntegrityAlert(
                settings.getAppBaseUrl(), report.snapshotDate(), report.mismatchCount(), report.repeatedSubmitLoopCount());
        try {
            outboxPublisher.publish(new OutboxEntry(
                    UUID.randomUUID().toString(),
                    NotificationEventType.STATUS_INTEGRITY_ALERT.code(),
                    null,
                    recipients,
                    email.subject(),
                    email.html()
            ));
        } catch (RuntimeException e) {
            // 다음 실행에서 다시 보내도록 마커 해제
            log.warn("[INTEGRITY ALERT] email enqueue failed", e);
            dailyMarkerStore.clear(EMAIL_MARKER, today);
            return new EmailAttempt(false, "enqueue_failed");
        }
        return new EmailAttempt(true, null);
    }

    static Map<String, Object> alertPayload(StatusIntegrityReport report) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("snapshotDate", report.snapshotDate());
        payload.put("generatedAt", report.generatedAt());
        payload.put("mismatchCount", report.mismatchCount());
        payload.put("repeatedSubmitLoopCount", report.repeatedSubmitLoopCount());
        payload.put("actionPath", ACTION_PATH);
        return payload;
    }

    private record EmailAttempt(boolean queued, String reason) {
    }
}
