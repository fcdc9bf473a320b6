package com.teamA.cra.common.notification.digest;

import com.teamA.cra.common.ddb.keys.DdbKeyFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import java.util.HashMap;
import java.util.Map;

import static com.teamA.cra.common.ddb.AttributeValues.*;

/**
 * PK = DIGEST#<digestDate>#<lang>, SK = EVT#<eventAt>#<id>
 *
 * 파티션 하나가 곧 "그 날 그 언어로 보낼 요약 메일 한 통"
 */
@Slf4j
@RequiredArgsConstructor
public class DynamoDigestQueueStore implements DigestQueueStore {

    private static final String ATTR_ID = "id";
    private static final String ATTR_EVENT_TYPE = "eventType";
    private static final String ATTR_REQUEST_ID = "requestId";
    private static final String ATTR_STATUS = "status";
    private static final String ATTR_PREVIOUS_STATUS = "previousStatus";
    private static final String ATTR_ACTOR_NAME = "actorName";
    private static final String ATTR_COMMENT = "comment";
    private static final String ATTR_TO_EMAILS = "toEmails";
    private static final String ATTR_LANG = "lang";
    private static final String ATTR_DIGEST_DATE = "digestDate";
    private static final String ATTR_EVENT_AT = "eventAt";

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;

    @Override
    public void enqueue(DigestQueueEntry entry) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put(DdbKeyFactory.ATTR_PK, s(DdbKeyFactory.digestPk(entry.digestDate(), entry.lang().code())));
        item.put(DdbKeyFactory.ATTR_SK, s(DdbKeyFactory.digestEventSk(entry.eventAt(), entry.id())));
        item.put(ATTR_ID, s(entry.id()));
        item.put(ATTR_EVENT_TYPE, s(entry.eventType().code()));
        item.put(ATTR_REQUEST_ID, s(entry.requestId()));
        item.put(ATTR_STATUS, s(entry.status().code()));
        if (entry.previousStatus() != null) {
            item.put(ATTR_PREVIOUS_STATUS, s(entry.previousStatus().code()));
        }
        putIfPresent(item, ATTR_ACTOR_NAME, entry.actorName());
        putIfPresent(item, ATTR_COMMENT, entry.comment());
        item.put(ATTR_TO_EMAILS, toAttrValue(entry.toEmails()));
        item.put(ATTR_LANG, s(entry.lang().code()));
        item.put(ATTR_DIGEST_DATE, s(entry.digestDate()));
        item.put(ATTR_EVENT_AT, n(entry.eventAt()));

        dynamoDbClient.putItem(PutItemRequest.builder()
                .tableName(tableName)
                .item(item)
                .build());

        log.debug("[DIGEST ENQUEUED] requestId={} date={} lang={}", entry.requestId(), entry.digestDate(), entry.lang().code());
    }
}
