package com.teamA.cra.worker.integrity;

import com.teamA.cra.common.domain.enums.NotificationLanguage;
import com.teamA.cra.common.domain.enums.Role;
import com.teamA.cra.common.integrity.StatusIntegrityReport;
import com.teamA.cra.common.integrity.StatusIntegrityService;
import com.teamA.cra.common.marker.DailyMarkerStore;
import com.teamA.cra.common.notification.inapp.InAppNotification;
import com.teamA.cra.common.notification.inapp.InAppNotificationStore;
import com.teamA.cra.common.notification.outbox.OutboxEntry;
import com.teamA.cra.common.notification.outbox.OutboxPublishException;
import com.teamA.cra.common.notification.outbox.OutboxPublisher;
import com.teamA.cra.common.notification.recipient.DirectoryUser;
import com.teamA.cra.common.notification.recipient.RecipientDirectory;
import com.teamA.cra.common.notification.settings.NotificationSettings;
import com.teamA.cra.common.notification.settings.NotificationSettingsStore;
import com.teamA.cra.common.notification.settings.SettingsMailCapabilityGate;
import com.teamA.cra.common.notification.template.TemplateRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class StatusIntegrityMonitorTest {

    private static final long NOW = Instant.parse("2026-10-18T06:00:00Z").toEpochMilli();

    private StatusIntegrityService service;
    private RecipientDirectory directory;
    private InAppNotificationStore inAppStore;
    private NotificationSettingsStore settingsStore;
    private OutboxPublisher outbox;
    private DailyMarkerStore markers;
    private StatusIntegrityMonitor monitor;

    @BeforeEach
    void setUp() {
        service = mock(StatusIntegrityService.class);
        directory = mock(RecipientDirectory.class);
        inAppStore = mock(InAppNotificationStore.class);
        settingsStore = mock(NotificationSettingsStore.class);
        outbox = mock(OutboxPublisher.class);
        markers = mock(DailyMarkerStore.class);

        monitor = new StatusIntegrityMonitor(service, directory, inAppStore, settingsStore,
                new SettingsMailCapabilityGate(), new TemplateRenderer(), outbox, markers, () -> NOW);
    }

    private static StatusIntegrityReport report(int mismatches) {
        List<StatusIntegrityReport.StatusMismatch> rows = mismatches == 0
                ? List.of()
                : List.of(new StatusIntegrityReport.StatusMismatch("CRA1", "under_review", "in_costing", null, null));
        return new StatusIntegrityReport("2026-10-18T06:00:00Z", 10, mismatches, 0, rows, List.of());
    }

    private static DirectoryUser admin(String id, boolean active) {
        return new DirectoryUser(id, id + "@cra.example", id, Role.ADMIN, NotificationLanguage.EN, active);
    }

    private static NotificationSettings mailReady() {
        return NotificationSettings.builder()
                .enabled(true)
                .transportConnected(true)
                .appBaseUrl("https://cra.example")
                .recipientsAdmin("ops@cra.example, lead@cra.example")
                .build();
    }

    @Test
    void shouldDoNothingWhenReportIsClean() {
        when(service.generateReport(StatusIntegrityMonitor.REPORT_LIMIT)).thenReturn(report(0));

        assertThat(monitor.check()).isEqualTo(MonitorResult.clean());
        verifyNoInteractions(directory, inAppStore, settingsStore, outbox, markers);
    }

    @Test
    void shouldAlertActiveAdminsAndQueueOneEmail() {
        when(service.generateReport(StatusIntegrityMonitor.REPORT_LIMIT)).thenReturn(report(3));
        when(directory.findActiveUsersByRole(Role.ADMIN)).thenReturn(List.of(admin("u-a1", true), admin("u-a2", false)));
        when(inAppStore.insertOnce(any(InAppNotification.class), eq(StatusIntegrityMonitor.IN_APP_MARKER), eq("2026-10-18")))
                .thenReturn(true);
        when(settingsStore.load()).thenReturn(mailReady());
        when(markers.tryMark(StatusIntegrityMonitor.EMAIL_MARKER, "2026-10-18")).thenReturn(true);

        MonitorResult result = monitor.check();

        assertThat(result).isEqualTo(new MonitorResult(3, 1, true, null));

        ArgumentCaptor<InAppNotification> inApp = ArgumentCaptor.forClass(InAppNotification.class);
        verify(inAppStore).insertOnce(inApp.capture(), anyString(), anyString());
        assertThat(inApp.getValue().userId()).isEqualTo("u-a1");
        assertThat(inApp.getValue().type()).isEqualTo("status_integrity_alert");
        assertThat(inApp.getValue().payload()).containsEntry("actionPath", "/settings?tab=deployments")
                .containsEntry("mismatchCount", 3);

        ArgumentCaptor<OutboxEntry> email = ArgumentCaptor.forClass(OutboxEntry.class);
        verify(outbox).publish(email.capture());
        assertThat(email.getValue().toEmails()).containsExactly("ops@cra.example", "lead@cra.example");
        assertThat(email.getValue().subject()).isEqualTo("[CRA] Status integrity alert (3)");
        assertThat(email.getValue().requestId()).isEmpty();
    }

    @Test
    void shouldNotRepeatInAppAlertForSameSnapshot() {
        when(service.generateReport(StatusIntegrityMonitor.REPORT_LIMIT)).thenReturn(report(1));
        when(directory.findActiveUsersByRole(Role.ADMIN)).thenReturn(List.of(admin("u-a1", true)));
        when(inAppStore.insertOnce(any(InAppNotification.class), anyString(), anyString())).thenReturn(false);
        when(settingsStore.load()).thenReturn(mailReady());
        when(markers.tryMark(anyString(), anyString())).thenReturn(false);

        MonitorResult result = monitor.check();

        assertThat(result.inAppInserted()).isZero();
        assertThat(result.emailQueued()).isFalse();
        assertThat(result.emailReason()).isEqualTo("already_queued_today");
        verify(outbox, never()).publish(any());
    }

    @Test
    void shouldSkipEmailWhenMailUnusable() {
        when(service.generateReport(StatusIntegrityMonitor.REPORT_LIMIT)).thenReturn(report(1));
        when(settingsStore.load()).thenReturn(mailReady().toBuilder().transportConnected(false).build());

        assertThat(monitor.check().emailReason()).isEqualTo("email_disabled_or_disconnected");
        verifyNoInteractions(markers, outbox);
    }

    @Test
    void shouldSkipEmailWithoutAdminRecipients() {
        when(service.generateReport(StatusIntegrityMonitor.REPORT_LIMIT)).thenReturn(report(1));
        when(settingsStore.load()).thenReturn(mailReady().toBuilder().recipientsAdmin(" ").build());

        assertThat(monitor.check().emailReason()).isEqualTo("no_admin_recipients");
    }

    @Test
    void shouldReleaseMarkerWhenEnqueueFails() {
        when(service.generateReport(StatusIntegrityMonitor.REPORT_LIMIT)).thenReturn(report(2));
        when(settingsStore.load()).thenReturn(mailReady());
        when(markers.tryMark(StatusIntegrityMonitor.EMAIL_MARKER, "2026-10-18")).thenReturn(true);
        doThrow(new OutboxPublishException("sqs down", new RuntimeException())).when(outbox).publish(any());

        MonitorResult result = monitor.check();

        assertThat(result.emailReason()).isEqualTo("enqueue_failed");
        verify(markers).clear(StatusIntegrityMonitor.EMAIL_MARKER, "2026-10-18");
    }

    @Test
    void shouldSurviveFailuresInsideTick() {
        when(service.generateReport(StatusIntegrityMonitor.REPORT_LIMIT)).thenThrow(new IllegalStateException("scan failed"));

        monitor.tick();
        monitor.tick();

        verify(service, times(2)).generateReport(StatusIntegrityMonitor.REPORT_LIMIT);
    }

    @Test
    void shouldReportSettingsUnavailable() {
        when(service.generateReport(StatusIntegrityMonitor.REPORT_LIMIT)).thenReturn(report(1));
        when(settingsStore.load()).thenThrow(new IllegalStateException("ddb down"));

        assertThat(monitor.check().emailReason()).isEqualTo("settings_unavailable");
    }
}
