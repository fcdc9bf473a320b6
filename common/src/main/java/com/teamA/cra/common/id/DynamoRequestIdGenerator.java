package com.teamA.cra.common.id;

import com.teamA.cra.common.ddb.keys.DdbKeyFactory;
import com.teamA.cra.common.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;

import static com.teamA.cra.common.ddb.AttributeValues.n;
import static com.teamA.cra.common.ddb.AttributeValues.s;

/**
 * 일자별 카운터 item에 ADD 1 (단일 원자 연산)
 *
 * PK = COUNTER#request_<yyMMdd>, SK = COUNTER
 */
@Slf4j
@RequiredArgsConstructor
public class DynamoRequestIdGenerator implements RequestIdGenerator {

    private static final DateTimeFormatter DATE_STAMP = DateTimeFormatter.ofPattern("yyMMdd");
    private static final String ATTR_SEQ = "seq";

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;
    private final Clock clock;
    private final ZoneId zoneId;
    private final String prefix;

    @Override
    public String nextId() {
        String dateStamp = DATE_STAMP.format(clock.now().atZone(zoneId));

        Map<String, AttributeValue> key = Map.of(
                DdbKeyFactory.ATTR_PK, s(DdbKeyFactory.requestCounterPk(dateStamp)),
                DdbKeyFactory.ATTR_SK, s(DdbKeyFactory.counterSk())
        );

        UpdateItemResponse res = dynamoDbClient.updateItem(UpdateItemRequest.builder()
                .tableName(tableName)
                .key(key)
                .updateExpression("ADD #seq :one")
                .expressionAttributeNames(Map.of("#seq", ATTR_SEQ))
                .expressionAttributeValues(Map.of(":one", n(1)))
                .returnValues(ReturnValue.UPDATED_NEW)
                .build());

        long seq = Long.parseLong(res.attributes().get(ATTR_SEQ).n());
        String id = format(prefix, dateStamp, seq);
        log.info("[REQUEST ID] issued id={}", id);
        return id;
    }

    static String format(String prefix, String dateStamp, long seq) {
        return prefix + dateStamp + String.format("%02d", seq);
    }
}
