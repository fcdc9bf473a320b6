package com.teamA.cra.common.transition;

import com.teamA.cra.common.draft.DraftIdempotencyGuard;
import com.teamA.cra.common.id.DynamoRequestIdGenerator;
import com.teamA.cra.common.id.RequestIdGenerator;
import com.teamA.cra.common.lock.AdvisoryLockManager;
import com.teamA.cra.common.lock.DynamoAdvisoryLockManager;
import com.teamA.cra.common.notification.NotificationDispatcher;
import com.teamA.cra.common.request.DynamoRequestStore;
import com.teamA.cra.common.request.RequestCreationService;
import com.teamA.cra.common.request.RequestEditService;
import com.teamA.cra.common.request.RequestStore;
import com.teamA.cra.common.time.Clock;
import com.teamA.cra.common.time.SystemClock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.time.ZoneId;

/**
 * request 라이프사이클 빈 (저장소, 규칙표, 엔진, draft guard, 생성/수정)
 */
@Configuration
public class StateTransitionConfig {

    @Bean
    public Clock clock() {
        return new SystemClock();
    }

    @Bean
    public TransitionLegality transitionLegality() {
        return new StatusTransitionRules();
    }

    @Bean
    public RequestStore requestStore(
            DynamoDbClient dynamoDbClient,
            @Value("${aws.dynamodb.table-name}") String tableName
    ) {
        return new DynamoRequestStore(dynamoDbClient, tableName);
    }

    @Bean
    public RequestIdGenerator requestIdGenerator(
            DynamoDbClient dynamoDbClient,
            @Value("${aws.dynamodb.table-name}") String tableName,
            @Value("${request.id-prefix:CRA}") String prefix,
            @Value("${request.id-zone-id:${notification.digest.zone-id:UTC}}") String zoneId,
            Clock clock
    ) {
        return new DynamoRequestIdGenerator(dynamoDbClient, tableName, clock, ZoneId.of(zoneId), prefix);
    }

    @Bean
    public AdvisoryLockManager advisoryLockManager(
            DynamoDbClient dynamoDbClient,
            @Value("${aws.dynamodb.table-name}") String tableName,
            @Value("${request.lock.lease-millis:10000}") long leaseMillis,
            @Value("${request.lock.wait-timeout-millis:5000}") long waitTimeoutMillis,
            Clock clock
    ) {
        return new DynamoAdvisoryLockManager(dynamoDbClient, tableName, clock, leaseMillis, waitTimeoutMillis);
    }

    @Bean
    public StateTransitionService stateTransitionService(
            RequestStore requestStore,
            TransitionLegality legality,
            NotificationDispatcher notificationDispatcher,
            Clock clock
    ) {
        return new RequestStateTransitionService(requestStore, legality, notificationDispatcher, clock);
    }

    @Bean
    public DraftIdempotencyGuard draftIdempotencyGuard(
            RequestStore requestStore,
            RequestIdGenerator requestIdGenerator,
            AdvisoryLockManager advisoryLockManager,
            Clock clock
    ) {
        return new DraftIdempotencyGuard(requestStore, requestIdGenerator, advisoryLockManager, clock);
    }

    @Bean
    public RequestCreationService requestCreationService(
            DraftIdempotencyGuard draftIdempotencyGuard,
            RequestStore requestStore,
            RequestIdGenerator requestIdGenerator,
            TransitionLegality legality,
            NotificationDispatcher notificationDispatcher,
            Clock clock
    ) {
        return new RequestCreationService(draftIdempotencyGuard, requestStore, requestIdGenerator,
                legality, notificationDispatcher, clock);
    }

    @Bean
    public RequestEditService requestEditService(
            RequestStore requestStore,
            NotificationDispatcher notificationDispatcher,
            Clock clock
    ) {
        return new RequestEditService(requestStore, notificationDispatcher, clock);
    }
}
