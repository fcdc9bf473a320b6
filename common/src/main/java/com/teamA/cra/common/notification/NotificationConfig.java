package com.teamA.cra.common.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.marker.DailyMarkerStore;
import com.teamA.cra.common.marker.DynamoDailyMarkerStore;
import com.teamA.cra.common.notification.digest.DigestDateCalculator;
import com.teamA.cra.common.notification.digest.DigestQueueStore;
import com.teamA.cra.common.notification.digest.DynamoDigestQueueStore;
import com.teamA.cra.common.notification.inapp.DynamoInAppNotificationStore;
import com.teamA.cra.common.notification.inapp.InAppNotificationStore;
import com.teamA.cra.common.notification.language.LanguageGrouper;
import com.teamA.cra.common.notification.outbox.OutboxPublisher;
import com.teamA.cra.common.notification.outbox.SqsOutboxPublisher;
import com.teamA.cra.common.notification.recipient.DynamoRecipientDirectory;
import com.teamA.cra.common.notification.recipient.RecipientDirectory;
import com.teamA.cra.common.notification.recipient.RecipientResolver;
import com.teamA.cra.common.notification.settings.DynamoNotificationSettingsStore;
import com.teamA.cra.common.notification.settings.MailCapabilityGate;
import com.teamA.cra.common.notification.settings.NotificationSettingsStore;
import com.teamA.cra.common.notification.settings.SettingsMailCapabilityGate;
import com.teamA.cra.common.notification.template.TemplateRenderer;
import com.teamA.cra.common.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.sqs.SqsClient;

import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Set;

/**
 * 알림 파이프라인 빈 (설정 -> 수신자 -> 언어 -> 템플릿 -> outbox / digest / in-app)
 */
@Configuration
public class NotificationConfig {

    @Bean
    public NotificationSettingsStore notificationSettingsStore(
            DynamoDbClient dynamoDbClient,
            @Value("${aws.dynamodb.table-name}") String tableName,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        return new DynamoNotificationSettingsStore(dynamoDbClient, tableName, objectMapper, clock);
    }

    @Bean
    public MailCapabilityGate mailCapabilityGate() {
        return new SettingsMailCapabilityGate();
    }

    @Bean
    public RecipientDirectory recipientDirectory(
            DynamoDbEnhancedClient enhancedClient,
            @Value("${aws.dynamodb.table-name}") String tableName
    ) {
        return new DynamoRecipientDirectory(enhancedClient, tableName);
    }

    @Bean
    public RecipientResolver recipientResolver(
            @Value("${notification.urgent-statuses:gm_approval_pending}") String[] urgentStatuses
    ) {
        Set<RequestStatus> urgent = EnumSet.noneOf(RequestStatus.class);
        for (String code : urgentStatuses) {
            if (code == null || code.isBlank()) continue;
            urgent.add(RequestStatus.fromCode(code)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown urgent status: " + code)));
        }
        return new RecipientResolver(urgent);
    }

    @Bean
    public LanguageGrouper languageGrouper(RecipientDirectory recipientDirectory) {
        return new LanguageGrouper(recipientDirectory);
    }

    @Bean
    public TemplateRenderer templateRenderer() {
        return new TemplateRenderer();
    }

    @Bean
    public DigestDateCalculator digestDateCalculator(
            @Value("${notification.digest.zone-id:UTC}") String zoneId,
            @Value("${notification.digest.cutoff-hour:16}") int cutoffHour
    ) {
        return new DigestDateCalculator(ZoneId.of(zoneId), cutoffHour);
    }

    @Bean
    public OutboxPublisher outboxPublisher(
            SqsClient sqsClient,
            @Value("${aws.sqs.outbox-queue-url}") String queueUrl,
            ObjectMapper objectMapper
    ) {
        return new SqsOutboxPublisher(sqsClient, queueUrl, objectMapper);
    }

    @Bean
    public DigestQueueStore digestQueueStore(
            DynamoDbClient dynamoDbClient,
            @Value("${aws.dynamodb.table-name}") String tableName
    ) {
        return new DynamoDigestQueueStore(dynamoDbClient, tableName);
    }

    @Bean
    public InAppNotificationStore inAppNotificationStore(
            DynamoDbClient dynamoDbClient,
            @Value("${aws.dynamodb.table-name}") String tableName,
            Clock clock
    ) {
        return new DynamoInAppNotificationStore(dynamoDbClient, tableName, clock);
    }

    @Bean
    public DailyMarkerStore dailyMarkerStore(
            DynamoDbClient dynamoDbClient,
            @Value("${aws.dynamodb.table-name}") String tableName,
            Clock clock
    ) {
        return new DynamoDailyMarkerStore(dynamoDbClient, tableName, clock);
    }

    @Bean
    public NotificationDispatcher notificationDispatcher(
            NotificationSettingsStore settingsStore,
            MailCapabilityGate mailCapabilityGate,
            RecipientResolver recipientResolver,
            LanguageGrouper languageGrouper,
            TemplateRenderer templateRenderer,
            RecipientDirectory recipientDirectory,
            OutboxPublisher outboxPublisher,
            DigestQueueStore digestQueueStore,
            InAppNotificationStore inAppNotificationStore,
            DigestDateCalculator digestDateCalculator,
            Clock clock
    ) {
        return new DefaultNotificationDispatcher(settingsStore, mailCapabilityGate, recipientResolver,
                languageGrouper, templateRenderer, recipientDirectory, outboxPublisher, digestQueueStore,
                inAppNotificationStore, digestDateCalculator, clock);
    }
}
