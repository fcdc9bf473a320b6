package com.teamA.cra.common.marker;

import com.teamA.cra.common.ddb.keys.DdbKeyFactory;
import com.teamA.cra.common.time.Clock;
import lombok.RequiredArgsConstructor;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import java.util.Map;

import static com.teamA.cra.common.ddb.AttributeValues.n;
import static com.teamA.cra.common.ddb.AttributeValues.s;

/**
 * PK = MARKER#<name>#<date>, SK = ONCE
 */
@RequiredArgsConstructor
public class DynamoDailyMarkerStore implements DailyMarkerStore {

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;
    private final Clock clock;

    @Override
    public boolean tryMark(String name, String date) {
        Map<String, AttributeValue> item = Map.of(
                DdbKeyFactory.ATTR_PK, s(DdbKeyFactory.dailyMarkerPk(name, date)),
                DdbKeyFactory.ATTR_SK, s(DdbKeyFactory.markerSk(null)),
                "markedAt", n(clock.nowMillis())
        );

        try {
            dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(item)
                    .conditionExpression("attribute_not_exists(#pk)")
                    .expressionAttributeNames(Map.of("#pk", DdbKeyFactory.ATTR_PK))
                    .build());
            return true;
        } catch (ConditionalCheckFailedException e) {
            return false;
        }
    }

    @Override
    public void clear(String name, String date) {
        dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                .tableName(tableName)
                .key(Map.of(
                        DdbKeyFactory.ATTR_PK, s(DdbKeyFactory.dailyMarkerPk(name, date)),
                        DdbKeyFactory.ATTR_SK, s(DdbKeyFactory.markerSk(null))
                ))
                .build());
    }
}
