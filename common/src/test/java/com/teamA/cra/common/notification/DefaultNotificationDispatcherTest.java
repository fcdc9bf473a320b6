package com.teamA.cra.common.notification;

import com.teamA.cra.common.domain.enums.NotificationEventType;
import com.teamA.cra.common.domain.enums.NotificationLanguage;
import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.enums.Role;
import com.teamA.cra.common.domain.model.RequestItem;
import com.teamA.cra.common.notification.digest.DigestDateCalculator;
import com.teamA.cra.common.notification.digest.DigestQueueEntry;
import com.teamA.cra.common.notification.digest.DigestQueueStore;
import com.teamA.cra.common.notification.inapp.InAppNotification;
import com.teamA.cra.common.notification.inapp.InAppNotificationStore;
import com.teamA.cra.common.notification.language.LanguageGrouper;
import com.teamA.cra.common.notification.outbox.OutboxEntry;
import com.teamA.cra.common.notification.outbox.OutboxPublishException;
import com.teamA.cra.common.notification.outbox.OutboxPublisher;
import com.teamA.cra.common.notification.recipient.DirectoryUser;
import com.teamA.cra.common.notification.recipient.RecipientDirectory;
import com.teamA.cra.common.notification.recipient.RecipientResolver;
import com.teamA.cra.common.notification.settings.NotificationSettings;
import com.teamA.cra.common.notification.settings.NotificationSettingsStore;
import com.teamA.cra.common.notification.settings.SettingsMailCapabilityGate;
import com.teamA.cra.common.notification.template.TemplateRenderer;
import com.teamA.cra.common.support.FixedClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DefaultNotificationDispatcherTest {

    private NotificationSettingsStore settingsStore;
    private RecipientDirectory directory;
    private OutboxPublisher outbox;
    private DigestQueueStore digestStore;
    private InAppNotificationStore inAppStore;
    private FixedClock clock;
    private DefaultNotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        settingsStore = mock(NotificationSettingsStore.class);
        directory = mock(RecipientDirectory.class);
        outbox = mock(OutboxPublisher.class);
        digestStore = mock(DigestQueueStore.class);
        inAppStore = mock(InAppNotificationStore.class);
        // 16:30 CEST
        clock = FixedClock.at("2026-10-18T14:30:00Z");

        dispatcher = new DefaultNotificationDispatcher(
                settingsStore,
                new SettingsMailCapabilityGate(),
                RecipientResolver.withDefaultUrgency(),
                new LanguageGrouper(directory),
                new TemplateRenderer(),
                directory,
                outbox,
                digestStore,
                inAppStore,
                new DigestDateCalculator(ZoneId.of("Europe/Paris"), 16),
                clock
        );
    }

    private NotificationSettings.NotificationSettingsBuilder enabledSettings() {
        return NotificationSettings.builder()
                .enabled(true)
                .transportConnected(true)
                .appBaseUrl("https://cra.example")
                .recipientsSales("sales@cra.example")
                .recipientsDesign("design@cra.example")
                .recipientsAdmin("admin@cra.example");
    }

    private NotificationEvent event(RequestStatus status, RequestStatus previous) {
        RequestItem request = RequestItem.builder()
                .requestId("CRA26101801")
                .status(status)
                .clientName("ACME")
                .updatedAt(clock.nowMillis())
                .build();
        return NotificationEvent.builder()
                .request(request)
                .requestId("CRA26101801")
                .eventType(NotificationEventType.REQUEST_STATUS_CHANGED)
                .status(status)
                .previousStatus(previous)
                .actorId("u-sales")
                .actorName("Sam Sales")
                .comment(" please approve ")
                .build();
    }

    private static DirectoryUser user(String id, Role role, NotificationLanguage lang) {
        return new DirectoryUser(id, id + "@cra.example", id, role, lang, true);
    }

    @Test
    void shouldSendUrgentStatusImmediatelyPerLanguage() {
        when(settingsStore.load()).thenReturn(enabledSettings().build());
        when(directory.preferredLanguages(anyCollection())).thenReturn(Map.of("admin@cra.example", NotificationLanguage.FR));

        DispatchOutcome outcome = dispatcher.dispatch(event(RequestStatus.GM_APPROVAL_PENDING, RequestStatus.SALES_FOLLOWUP));

        assertThat(outcome.immediateEmailEnqueued()).isTrue();
        assertThat(outcome.digestEnqueued()).isZero();
        assertThat(outcome.skipReason()).isNull();

        ArgumentCaptor<OutboxEntry> captor = ArgumentCaptor.forClass(OutboxEntry.class);
        verify(outbox, times(2)).publish(captor.capture());
        List<OutboxEntry> sent = captor.getAllValues();
        assertThat(sent.get(0).toEmails()).containsExactly("sales@cra.example");
        assertThat(sent.get(0).subject()).startsWith("[CRA] Request CRA26101801");
        assertThat(sent.get(1).toEmails()).containsExactly("admin@cra.example");
        assertThat(sent.get(1).subject()).startsWith("[CRA] Demande CRA26101801");
        assertThat(sent).allSatisfy(e -> assertThat(e.eventType()).isEqualTo("request_status_changed"));
        verifyNoInteractions(digestStore);
    }

    @Test
    void shouldQueueAdminDigestForNonUrgentStatus() {
        when(settingsStore.load()).thenReturn(enabledSettings().build());

        DispatchOutcome outcome = dispatcher.dispatch(event(RequestStatus.SUBMITTED, RequestStatus.DRAFT));

        assertThat(outcome.immediateEmailEnqueued()).isTrue();
        assertThat(outcome.digestEnqueued()).isEqualTo(1);

        ArgumentCaptor<DigestQueueEntry> captor = ArgumentCaptor.forClass(DigestQueueEntry.class);
        verify(digestStore).enqueue(captor.capture());
        DigestQueueEntry entry = captor.getValue();
        assertThat(entry.toEmails()).containsExactly("admin@cra.example");
        assertThat(entry.digestDate()).isEqualTo("2026-10-19");
        assertThat(entry.lang()).isEqualTo(NotificationLanguage.EN);
        assertThat(entry.comment()).isEqualTo("please approve");
        assertThat(entry.previousStatus()).isEqualTo(RequestStatus.DRAFT);
        assertThat(entry.eventAt()).isEqualTo(clock.nowMillis());
    }

    @Test
    void shouldWriteInAppForBuiltInRolesExcludingActor() {
        when(settingsStore.load()).thenReturn(enabledSettings().build());
        when(directory.findActiveUsersByRole(Role.SALES)).thenReturn(List.of(
                user("u-sales", Role.SALES, NotificationLanguage.EN),
                user("u-sales2", Role.SALES, NotificationLanguage.EN)));
        when(directory.findActiveUsersByRole(Role.ADMIN)).thenReturn(List.of(
                user("u-admin", Role.ADMIN, NotificationLanguage.FR),
                user("u-sales2", Role.ADMIN, NotificationLanguage.EN)));

        DispatchOutcome outcome = dispatcher.dispatch(event(RequestStatus.GM_APPROVAL_PENDING, RequestStatus.SALES_FOLLOWUP));

        assertThat(outcome.inAppEnqueued()).isEqualTo(2);
        ArgumentCaptor<InAppNotification> captor = ArgumentCaptor.forClass(InAppNotification.class);
        verify(inAppStore, times(2)).insert(captor.capture());
        assertThat(captor.getAllValues()).extracting(InAppNotification::userId).containsExactly("u-sales2", "u-admin");

        InAppNotification first = captor.getAllValues().get(0);
        assertThat(first.title()).isEqualTo("Request CRA26101801 - ACME");
        assertThat(first.payload()).containsEntry("clientName", "ACME");
        assertThat(first.body()).endsWith("(Sam Sales)").contains(" -> ");
        assertThat(first.read()).isFalse();
        assertThat(first.payload()).containsEntry("actionPath", "/requests/CRA26101801");
    }

    @Test
    void shouldSkipEverythingWhenMailDisabled() {
        when(settingsStore.load()).thenReturn(enabledSettings().enabled(false).build());

        DispatchOutcome outcome = dispatcher.dispatch(event(RequestStatus.SUBMITTED, RequestStatus.DRAFT));

        assertThat(outcome).isEqualTo(DispatchOutcome.skipped(DispatchOutcome.DISABLED));
        verifyNoInteractions(outbox, digestStore, inAppStore);
    }

    @Test
    void shouldSkipWhenTransportNotConnected() {
        when(settingsStore.load()).thenReturn(enabledSettings().transportConnected(false).build());

        DispatchOutcome outcome = dispatcher.dispatch(event(RequestStatus.SUBMITTED, RequestStatus.DRAFT));

        assertThat(outcome.skipReason()).isEqualTo(DispatchOutcome.NOT_CONNECTED);
        assertThat(outcome.anythingEnqueued()).isFalse();
    }

    @Test
    void shouldReportSettingsUnavailable() {
        when(settingsStore.load()).thenThrow(new IllegalStateException("ddb down"));

        DispatchOutcome outcome = dispatcher.dispatch(event(RequestStatus.SUBMITTED, RequestStatus.DRAFT));

        assertThat(outcome.skipReason()).isEqualTo(DispatchOutcome.SETTINGS_UNAVAILABLE);
    }

    @Test
    void shouldKeepOtherLanguageGroupsWhenOnePublishFails() {
        when(settingsStore.load()).thenReturn(enabledSettings().build());
        when(directory.preferredLanguages(anyCollection())).thenReturn(Map.of("admin@cra.example", NotificationLanguage.ZH));
        doThrow(new OutboxPublishException("sqs down", new RuntimeException()))
                .doNothing()
                .when(outbox).publish(any(OutboxEntry.class));

        DispatchOutcome outcome = dispatcher.dispatch(event(RequestStatus.GM_APPROVAL_PENDING, RequestStatus.SALES_FOLLOWUP));

        assertThat(outcome.immediateEmailEnqueued()).isTrue();
        verify(outbox, times(2)).publish(any(OutboxEntry.class));
    }

    @Test
    void shouldReportNoRecipientsWithInAppCount() {
        when(settingsStore.load()).thenReturn(NotificationSettings.builder().enabled(true).transportConnected(true).build());
        when(directory.findActiveUsersByRole(Role.DESIGN)).thenReturn(List.of(user("u-design", Role.DESIGN, NotificationLanguage.EN)));
        doNothing().when(inAppStore).insert(any(InAppNotification.class));

        DispatchOutcome outcome = dispatcher.dispatch(event(RequestStatus.SUBMITTED, RequestStatus.DRAFT));

        assertThat(outcome.skipReason()).isEqualTo(DispatchOutcome.NO_RECIPIENTS);
        assertThat(outcome.inAppEnqueued()).isEqualTo(1);
        verifyNoInteractions(outbox, digestStore);
    }
}
