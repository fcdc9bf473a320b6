package com.teamA.cra.common.lock;

import com.teamA.cra.common.ddb.keys.DdbKeyFactory;
import com.teamA.cra.common.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

import static com.teamA.cra.common.ddb.AttributeValues.n;
import static com.teamA.cra.common.ddb.AttributeValues.s;

/**
 * 조건부 put 기반 lease lock
 *
 * - 획득: attribute_not_exists(PK) OR expiresAt < now
 * - 해제: owner가 나일 때만 delete
 * - lease가 만료되면 다른 쪽이 가져갈 수 있다 (프로세스가 죽어도 영구 lock 없음)
 */
@Slf4j
@RequiredArgsConstructor
public class DynamoAdvisoryLockManager implements AdvisoryLockManager {

    private static final String ATTR_OWNER = "owner";
    private static final String ATTR_EXPIRES_AT = "expiresAt";

    private static final long MIN_BACKOFF_MILLIS = 25L;
    private static final long MAX_BACKOFF_MILLIS = 200L;

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;
    private final Clock clock;
    private final long leaseMillis;
    private final long waitTimeoutMillis;

    @Override
    public <T> T withLock(String key1, String key2, Supplier<T> work) {
        String lockPk = DdbKeyFactory.lockPk(key1, key2);
        String owner = UUID.randomUUID().toString();

        acquire(lockPk, owner);
        try {
            return work.get();
        } finally {
            release(lockPk, owner);
        }
    }

    private void acquire(String lockPk, String owner) {
        long startedAt = clock.nowMillis();
        long backoff = MIN_BACKOFF_MILLIS;

        while (true) {
            if (tryAcquire(lockPk, owner)) {
                return;
            }

            long waited = clock.nowMillis() - startedAt;
            if (waited >= waitTimeoutMillis) {
                log.warn("[LOCK TIMEOUT] lock={} waited={}ms", lockPk, waited);
                throw new LockAcquisitionException(lockPk, waited);
            }

            sleep(Math.min(backoff, Math.max(1L, waitTimeoutMillis - waited)));
            backoff = Math.min(backoff * 2, MAX_BACKOFF_MILLIS);
        }
    }

    boolean tryAcquire(String lockPk, String owner) {
        long now = clock.nowMillis();

        Map<String, AttributeValue> item = Map.of(
                DdbKeyFactory.ATTR_PK, s(lockPk),
                DdbKeyFactory.ATTR_SK, s(DdbKeyFactory.lockSk()),
                ATTR_OWNER, s(owner),
                ATTR_EXPIRES_AT, n(now + leaseMillis)
        );

        PutItemRequest req = PutItemRequest.builder()
                .tableName(tableName)
                .item(item)
                .conditionExpression("attribute_not_exists(#pk) OR #expiresAt < :now")
                .expressionAttributeNames(Map.of(
                        "#pk", DdbKeyFactory.ATTR_PK,
                        "#expiresAt", ATTR_EXPIRES_AT
                ))
                .expressionAttributeValues(Map.of(":now", n(now)))
                .build();

        try {
            dynamoDbClient.putItem(req);
            return true;
        } catch (ConditionalCheckFailedException e) {
            return false;
        }
    }

    private void release(String lockPk, String owner) {
        Map<String, AttributeValue> key = Map.of(
                DdbKeyFactory.ATTR_PK, s(lockPk),
                DdbKeyFactory.ATTR_SK, s(DdbKeyFactory.lockSk())
        );

        try {
            dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                    .tableName(tableName)
                    .key(key)
                    .conditionExpression("#owner = :owner")
                    .expressionAttributeNames(Map.of("#owner", ATTR_OWNER))
                    .expressionAttributeValues(Map.of(":owner", s(owner)))
                    .build());
        } catch (ConditionalCheckFailedException e) {
            // lease 만료 후 다른 owner가 가져간 경우
            log.warn("[LOCK LOST] lock={} lease expired before release", lockPk);
        }
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("interrupted", 0L);
        }
    }
}
