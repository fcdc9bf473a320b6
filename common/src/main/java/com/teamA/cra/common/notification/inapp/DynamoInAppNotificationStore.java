package com.teamA.cra.common.notification.inapp;

import com.teamA.cra.common.ddb.keys.DdbKeyFactory;
import com.teamA.cra.common.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.teamA.cra.common.ddb.AttributeValues.*;

/**
 * PK = USER#<userId>, SK = NOTI#<notificationId>
 *
 * insertOnce 는 마커 item(MARKER#name#date / userId)과 알림을 한 트랜잭션으로 쓴다.
 */
@Slf4j
@RequiredArgsConstructor
public class DynamoInAppNotificationStore implements InAppNotificationStore {

    private static final String ATTR_ID = "notificationId";
    private static final String ATTR_USER_ID = "userId";
    private static final String ATTR_TYPE = "type";
    private static final String ATTR_TITLE = "title";
    private static final String ATTR_BODY = "body";
    private static final String ATTR_REQUEST_ID = "requestId";
    private static final String ATTR_PAYLOAD = "payload";
    private static final String ATTR_IS_READ = "isRead";
    private static final String ATTR_CREATED_AT = "createdAt";
    private static final String ATTR_READ_AT = "readAt";

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;
    private final Clock clock;

    @Override
    public void insert(InAppNotification notification) {
        dynamoDbClient.putItem(PutItemRequest.builder()
                .tableName(tableName)
                .item(toItem(notification))
                .conditionExpression("attribute_not_exists(#pk)")
                .expressionAttributeNames(Map.of("#pk", DdbKeyFactory.ATTR_PK))
                .build());
    }

    @Override
    public boolean insertOnce(InAppNotification notification, String markerName, String markerDate) {
        Map<String, AttributeValue> marker = new HashMap<>();
        marker.put(DdbKeyFactory.ATTR_PK, s(DdbKeyFactory.dailyMarkerPk(markerName, markerDate)));
        marker.put(DdbKeyFactory.ATTR_SK, s(DdbKeyFactory.markerSk(notification.userId())));
        marker.put(ATTR_CREATED_AT, n(clock.nowMillis()));

        Map<String, String> names = Map.of("#pk", DdbKeyFactory.ATTR_PK);

        TransactWriteItemsRequest tx = TransactWriteItemsRequest.builder()
                .transactItems(
                        TransactWriteItem.builder().put(Put.builder()
                                .tableName(tableName)
                                .item(marker)
                                .conditionExpression("attribute_not_exists(#pk)")
                                .expressionAttributeNames(names)
                                .build()).build(),
                        TransactWriteItem.builder().put(Put.builder()
                                .tableName(tableName)
                                .item(toItem(notification))
                                .conditionExpression("attribute_not_exists(#pk)")
                                .expressionAttributeNames(names)
                                .build()).build()
                )
                .build();

        try {
            dynamoDbClient.transactWriteItems(tx);
            return true;
        } catch (TransactionCanceledException e) {
            if (isConditionFailure(e)) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public List<InAppNotification> list(String userId, boolean unreadOnly, int limit) {
        int max = InAppNotificationStore.clampLimit(limit);
        List<InAppNotification> result = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;

        Map<String, String> names = new HashMap<>();
        names.put("#pk", DdbKeyFactory.ATTR_PK);
        names.put("#sk", DdbKeyFactory.ATTR_SK);
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":pk", s(DdbKeyFactory.userPk(userId)));
        values.put(":prefix", s(DdbKeyFactory.notificationSkPrefix()));
        if (unreadOnly) {
            names.put("#read", ATTR_IS_READ);
            values.put(":false", bool(false));
        }

        // filter는 limit 이후에 적용되므로 모자라면 다음 페이지로
        do {
            QueryRequest.Builder req = QueryRequest.builder()
                    .tableName(tableName)
                    .keyConditionExpression("#pk = :pk AND begins_with(#sk, :prefix)")
                    .expressionAttributeNames(names)
                    .expressionAttributeValues(values)
                    .scanIndexForward(false)
                    .limit(max);
            if (unreadOnly) req.filterExpression("#read = :false");
            if (startKey != null) req.exclusiveStartKey(startKey);

            QueryResponse res = dynamoDbClient.query(req.build());
            for (Map<String, AttributeValue> item : res.items()) {
                result.add(fromItem(item));
                if (result.size() >= max) return result;
            }
            startKey = res.hasLastEvaluatedKey() && !res.lastEvaluatedKey().isEmpty()
                    ? res.lastEvaluatedKey()
                    : null;
        } while (startKey != null);

        return result;
    }

    @Override
    public boolean markRead(String userId, String notificationId) {
        UpdateItemRequest req = UpdateItemRequest.builder()
                .tableName(tableName)
                .key(Map.of(
                        DdbKeyFactory.ATTR_PK, s(DdbKeyFactory.userPk(userId)),
                        DdbKeyFactory.ATTR_SK, s(DdbKeyFactory.notificationSk(notificationId))
                ))
                .updateExpression("SET #read = :true, #readAt = :now")
                .conditionExpression("attribute_exists(#pk) AND #read = :false")
                .expressionAttributeNames(Map.of(
                        "#pk", DdbKeyFactory.ATTR_PK,
                        "#read", ATTR_IS_READ,
                        "#readAt", ATTR_READ_AT
                ))
                .expressionAttributeValues(Map.of(
                        ":true", bool(true),
                        ":false", bool(false),
                        ":now", n(clock.nowMillis())
                ))
                .build();

        try {
            dynamoDbClient.updateItem(req);
            return true;
        } catch (ConditionalCheckFailedException e) {
            return false;
        }
    }

    @Override
    public int markAllRead(String userId) {
        int marked = 0;
        List<InAppNotification> unread;
        do {
            unread = list(userId, true, MAX_LIMIT);
            int before = marked;
            for (InAppNotification unreadOne : unread) {
                if (markRead(userId, unreadOne.id())) marked++;
            }
            // 아무것도 못 바꿨으면 (동시 처리) 무한루프 방지
            if (marked == before) break;
        } while (unread.size() == MAX_LIMIT);

        log.info("[INAPP READ ALL] userId={} marked={}", userId, marked);
        return marked;
    }

    private static boolean isConditionFailure(TransactionCanceledException e) {
        if (!e.hasCancellationReasons()) return false;
        for (CancellationReason reason : e.cancellationReasons()) {
            if ("ConditionalCheckFailed".equals(reason.code())) return true;
        }
        return false;
    }

    static Map<String, AttributeValue> toItem(InAppNotification notification) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put(DdbKeyFactory.ATTR_PK, s(DdbKeyFactory.userPk(notification.userId())));
        item.put(DdbKeyFactory.ATTR_SK, s(DdbKeyFactory.notificationSk(notification.id())));
        item.put(ATTR_ID, s(notification.id()));
        item.put(ATTR_USER_ID, s(notification.userId()));
        item.put(ATTR_TYPE, s(notification.type()));
        putIfPresent(item, ATTR_TITLE, notification.title());
        putIfPresent(item, ATTR_BODY, notification.body());
        putIfPresent(item, ATTR_REQUEST_ID, notification.requestId());
        item.put(ATTR_PAYLOAD, toAttrValue(notification.payload()));
        item.put(ATTR_IS_READ, bool(notification.read()));
        item.put(ATTR_CREATED_AT, n(notification.createdAt()));
        putIfPresent(item, ATTR_READ_AT, notification.readAt());
        return item;
    }

    @SuppressWarnings("unchecked")
    static InAppNotification fromItem(Map<String, AttributeValue> item) {
        Object payload = fromAttrValue(item.get(ATTR_PAYLOAD));
        return InAppNotification.builder()
                .id(string(item, ATTR_ID))
                .userId(string(item, ATTR_USER_ID))
                .type(string(item, ATTR_TYPE))
                .title(string(item, ATTR_TITLE))
                .body(string(item, ATTR_BODY))
                .requestId(string(item, ATTR_REQUEST_ID))
                .payload(payload instanceof Map<?, ?> ? (Map<String, Object>) payload : Map.of())
                .read(bool(item, ATTR_IS_READ, false))
                .createdAt(number(item, ATTR_CREATED_AT, 0L))
                .readAt(number(item, ATTR_READ_AT))
                .build();
    }
}
