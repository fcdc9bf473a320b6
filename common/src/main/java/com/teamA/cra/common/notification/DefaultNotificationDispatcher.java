package com.teamA.cra.common.notification;

import com.teamA.cra.common.domain.enums.Role;
import com.teamA.cra.common.notification.digest.DigestDateCalculator;
import com.teamA.cra.common.notification.digest.DigestQueueEntry;
import com.teamA.cra.common.notification.digest.DigestQueueStore;
import com.teamA.cra.common.notification.inapp.InAppNotification;
import com.teamA.cra.common.notification.inapp.InAppNotificationStore;
import com.teamA.cra.common.notification.language.LanguageGroup;
import com.teamA.cra.common.notification.language.LanguageGrouper;
import com.teamA.cra.common.notification.outbox.OutboxEntry;
import com.teamA.cra.common.notification.outbox.OutboxPublisher;
import com.teamA.cra.common.notification.recipient.DirectoryUser;
import com.teamA.cra.common.notification.recipient.RecipientDirectory;
import com.teamA.cra.common.notification.recipient.RecipientResolution;
import com.teamA.cra.common.notification.recipient.RecipientResolver;
import com.teamA.cra.common.notification.recipient.StatusRoleTable;
import com.teamA.cra.common.notification.settings.MailCapabilityGate;
import com.teamA.cra.common.notification.settings.NotificationSettings;
import com.teamA.cra.common.notification.settings.NotificationSettingsStore;
import com.teamA.cra.common.notification.template.EmailStrings;
import com.teamA.cra.common.notification.template.RenderedEmail;
import com.teamA.cra.common.notification.template.TemplateRenderer;
import com.teamA.cra.common.notification.template.TemplateVariables;
import com.teamA.cra.common.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 알림 디스패치
 *
 * 1) 설정 로드 -> 2) 메일 가능 여부 -> 3) in-app / 즉시 메일 / digest (서로 격리)
 *
 * ❗ 어떤 경우에도 호출자에게 예외를 던지지 않는다 (전이는 이미 커밋됨)
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultNotificationDispatcher implements NotificationDispatcher {

    private final NotificationSettingsStore settingsStore;
    private final MailCapabilityGate mailCapabilityGate;
    private final RecipientResolver recipientResolver;
    private final LanguageGrouper languageGrouper;
    private final TemplateRenderer templateRenderer;
    private final RecipientDirectory recipientDirectory;
    private final OutboxPublisher outboxPublisher;
    private final DigestQueueStore digestQueueStore;
    private final InAppNotificationStore inAppNotificationStore;
    private final DigestDateCalculator digestDateCalculator;
    private final Clock clock;

    @Override
    public DispatchOutcome dispatch(NotificationEvent event) {
        try {
            return doDispatch(event);
        } catch (RuntimeException e) {
            log.error("[DISPATCH FAILED] requestId={} eventType={}", event.requestId(), event.eventType().code(), e);
            return DispatchOutcome.skipped(DispatchOutcome.DISPATCH_FAILED);
        }
    }

    private DispatchOutcome doDispatch(NotificationEvent event) {
        NotificationSettings settings;
        try {
            settings = settingsStore.load();
        } catch (RuntimeException e) {
            log.warn("[DISPATCH SKIPPED] requestId={} settings unavailable", event.requestId(), e);
            return DispatchOutcome.skipped(DispatchOutcome.SETTINGS_UNAVAILABLE);
        }

        String unusable = mailCapabilityGate.unusableReason(settings);
        if (unusable != null) {
            log.debug("[DISPATCH SKIPPED] requestId={} reason={}", event.requestId(), unusable);
            return DispatchOutcome.skipped(unusable);
        }

        int inApp = enqueueInApp(event);

        RecipientResolution resolution = recipientResolver.resolve(settings, event.status());
        boolean immediate = enqueueImmediate(settings, event, resolution.immediate());
        int digest = enqueueDigest(event, resolution.digestRoleGroups());

        log.info("[DISPATCH] requestId={} eventType={} status={} immediate={} digest={} inApp={}",
                event.requestId(), event.eventType().code(), event.status().code(), immediate, digest, inApp);

        if (resolution.isEmpty()) {
            return new DispatchOutcome(false, 0, inApp, DispatchOutcome.NO_RECIPIENTS);
        }
        return DispatchOutcome.of(immediate, digest, inApp);
    }

    /**
     * in-app: 기본 표(flowMap 무시)의 역할 중 활성 사용자, 본인 제외
     */
    private int enqueueInApp(NotificationEvent event) {
        Map<String, DirectoryUser> targets = new LinkedHashMap<>();
        try {
            for (Role role : StatusRoleTable.builtIn(event.status()).roles()) {
                for (DirectoryUser user : recipientDirectory.findActiveUsersByRole(role)) {
                    if (!user.active() || user.userId().equals(event.actorId())) continue;
                    targets.putIfAbsent(user.userId(), user);
                }
            }
        } catch (RuntimeException e) {
            log.warn("[INAPP SKIPPED] requestId={} recipient lookup failed", event.requestId(), e);
            return 0;
        }

        long now = clock.nowMillis();
        int written = 0;
        for (DirectoryUser user : targets.values()) {
            try {
                inAppNotificationStore.insert(inAppFor(event, user, now));
                written++;
            } catch (RuntimeException e) {
                log.warn("[INAPP FAILED] requestId={} userId={}", event.requestId(), user.userId(), e);
            }
        }
        return written;
    }

    private InAppNotification inAppFor(NotificationEvent event, DirectoryUser user, long now) {
        EmailStrings strings = EmailStrings.forLanguage(user.preferredLanguage());
        String statusLabel = strings.statusLabel(event.status().code());
        String previousLabel = event.previousStatus() == null ? "" : strings.statusLabel(event.previousStatus().code());

        String body = previousLabel.isEmpty() || previousLabel.equals(statusLabel)
                ? statusLabel
                : previousLabel + " -> " + statusLabel;
        if (event.actorName() != null && !event.actorName().isBlank()) {
            body = body + " (" + event.actorName() + ")";
        }

        String clientName = event.request() == null || event.request().getClientName() == null
                ? ""
                : event.request().getClientName().trim();
        String title = clientName.isEmpty()
                ? "Request " + event.requestId()
                : "Request " + event.requestId() + " - " + clientName;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requestId", event.requestId());
        payload.put("clientName", clientName);
        payload.put("status", event.status().code());
        payload.put("previousStatus", event.previousStatus() == null ? "" : event.previousStatus().code());
        payload.put("actorName", event.actorName() == null ? "" : event.actorName());
        payload.put("actionPath", "/requests/" + event.requestId());

        return InAppNotification.builder()
                .id(InAppNotification.newId(now))
                .userId(user.userId())
                .type(event.eventType().code())
                .title(title)
                .body(body)
                .requestId(event.requestId())
                .payload(payload)
                .read(false)
                .createdAt(now)
                .build();
    }

    private boolean enqueueImmediate(NotificationSettings settings, NotificationEvent event, List<String> addresses) {
        if (addresses.isEmpty()) return false;

        List<LanguageGroup> groups = languageGrouper.groupByLanguage(addresses);
        boolean any = false;
        for (LanguageGroup group : groups) {
            try {
                TemplateVariables vars = TemplateVariables.forRequest(
                        event.request(), event.requestId(), event.status(), event.previousStatus(),
                        group.language(), event.actorName(), event.comment());
                RenderedEmail email = templateRenderer.render(settings, event.eventType(), group.language(), vars);

                outboxPublisher.publish(new OutboxEntry(
                        UUID.randomUUID().toString(),
                        event.eventType().code(),
                        event.requestId(),
                        group.addresses(),
                        email.subject(),
                        email.html()
                ));
                any = true;
            } catch (RuntimeException e) {
                log.warn("[OUTBOX FAILED] requestId={} lang={} to={}",
                        event.requestId(), group.language().code(), group.addresses().size(), e);
            }
        }
        return any;
    }

    /**
     * digest: (역할, digestDate, 언어) 마다 한 줄
     */
    private int enqueueDigest(NotificationEvent event, Map<Role, List<String>> roleGroups) {
        if (roleGroups.isEmpty()) return 0;

        long now = clock.nowMillis();
        String digestDate = digestDateCalculator.digestDate(now);
        int written = 0;

        for (Map.Entry<Role, List<String>> roleGroup : roleGroups.entrySet()) {
            for (LanguageGroup group : languageGrouper.groupByLanguage(roleGroup.getValue())) {
                try {
                    digestQueueStore.enqueue(DigestQueueEntry.builder()
                            .id(UUID.randomUUID().toString())
                            .eventType(event.eventType())
                            .requestId(event.requestId())
                            .status(event.status())
                            .previousStatus(event.previousStatus())
                            .actorName(event.actorName())
                            .comment(event.comment() == null || event.comment().isBlank() ? null : event.comment().trim())
                            .toEmails(group.addresses())
                            .lang(group.language())
                            .digestDate(digestDate)
                            .eventAt(now)
                            .build());
                    written++;
                } catch (RuntimeException e) {
                    log.warn("[DIGEST FAILED] requestId={} role={} lang={}",
                            event.requestId(), roleGroup.getKey().code(), group.language().code(), e);
                }
            }
        }
        return written;
    }
}
