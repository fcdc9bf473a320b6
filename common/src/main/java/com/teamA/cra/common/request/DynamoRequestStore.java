package com.teamA.cra.common.request;

import com.teamA.cra.common.ddb.keys.DdbKeyFactory;
import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.model.HistoryEntry;
import com.teamA.cra.common.domain.model.RequestItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.teamA.cra.common.ddb.AttributeValues.*;
import static com.teamA.cra.common.request.RequestItemMapper.*;

/**
 * RequestStore DynamoDB 구현 (single-table, low-level client)
 *
 * - PK = REQ#{requestId}, SK = META
 * - draft 세션 pointer: PK = DRAFT#{creator}#{session}, SK = POINTER
 * - 조건부 쓰기 실패(ConditionalCheckFailedException)는 false로 변환
 */
@Slf4j
@RequiredArgsConstructor
public class DynamoRequestStore implements RequestStore {

    private static final String ATTR_POINTER_REQUEST_ID = "requestId";

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;

    @Override
    public Optional<RequestItem> findById(String requestId) {
        Map<String, AttributeValue> item = dynamoDbClient.getItem(GetItemRequest.builder()
                .tableName(tableName)
                .key(key(requestId))
                .consistentRead(true)
                .build()).item();

        if (item == null || item.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(fromItem(item));
    }

    @Override
    public void insert(RequestItem item) {
        Map<String, AttributeValue> map = toItem(item);

        if (item.getStatus() != RequestStatus.DRAFT || !item.hasDraftSession()) {
            try {
                dynamoDbClient.putItem(PutItemRequest.builder()
                        .tableName(tableName)
                        .item(map)
                        .conditionExpression("attribute_not_exists(#pk)")
                        .expressionAttributeNames(Map.of("#pk", DdbKeyFactory.ATTR_PK))
                        .build());
            } catch (ConditionalCheckFailedException e) {
                throw new IllegalStateException("Request already exists: " + item.getRequestId(), e);
            }
            return;
        }

        // draft + 세션키: request 본체와 세션 pointer를 한 트랜잭션으로
        Map<String, AttributeValue> pointer = new HashMap<>();
        pointer.put(DdbKeyFactory.ATTR_PK, s(DdbKeyFactory.draftSessionPk(item.getCreatedBy(), item.getDraftSessionKey())));
        pointer.put(DdbKeyFactory.ATTR_SK, s(DdbKeyFactory.pointerSk()));
        pointer.put(ATTR_POINTER_REQUEST_ID, s(item.getRequestId()));
        putIfPresent(pointer, ATTR_CREATED_AT, item.getCreatedAt());

        TransactWriteItemsRequest tx = TransactWriteItemsRequest.builder()
                .transactItems(
                        TransactWriteItem.builder().put(Put.builder()
                                .tableName(tableName)
                                .item(map)
                                .conditionExpression("attribute_not_exists(#pk)")
                                .expressionAttributeNames(Map.of("#pk", DdbKeyFactory.ATTR_PK))
                                .build()).build(),
                        TransactWriteItem.builder().put(Put.builder()
                                .tableName(tableName)
                                .item(pointer)
                                .build()).build()
                )
                .build();

        try {
            dynamoDbClient.transactWriteItems(tx);
        } catch (TransactionCanceledException e) {
            throw new IllegalStateException("Draft insert cancelled: " + item.getRequestId(), e);
        }
    }

    @Override
    public boolean replaceDraft(RequestItem item) {
        try {
            dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(toItem(item))
                    .conditionExpression("#status = :draft")
                    .expressionAttributeNames(Map.of("#status", ATTR_STATUS))
                    .expressionAttributeValues(Map.of(":draft", s(RequestStatus.DRAFT.code())))
                    .build());
            return true;
        } catch (ConditionalCheckFailedException e) {
            return false;
        }
    }

    @Override
    public boolean appendTransition(
            String requestId,
            RequestStatus expectedStatus,
            RequestStatus newStatus,
            List<HistoryEntry> entries,
            long updatedAt
    ) {
        Map<String, String> names = new HashMap<>();
        names.put("#status", ATTR_STATUS);
        names.put("#history", ATTR_HISTORY);
        names.put("#updatedAt", ATTR_UPDATED_AT);

        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":from", s(expectedStatus.code()));
        values.put(":to", s(newStatus.code()));
        values.put(":entries", historyValue(entries));
        values.put(":empty", list(List.of()));
        values.put(":now", n(updatedAt));

        String updateExpression =
                "SET #status = :to, #updatedAt = :now, #history = list_append(if_not_exists(#history, :empty), :entries)";

        // ❗draft를 벗어나면 세션 GSI에서 빠진다
        if (newStatus != RequestStatus.DRAFT) {
            names.put("#gsi1pk", DdbKeyFactory.ATTR_GSI1_PK);
            names.put("#gsi1sk", DdbKeyFactory.ATTR_GSI1_SK);
            updateExpression += " REMOVE #gsi1pk, #gsi1sk";
        }

        UpdateItemRequest req = UpdateItemRequest.builder()
                .tableName(tableName)
                .key(key(requestId))
                .conditionExpression("#status = :from")
                .updateExpression(updateExpression)
                .expressionAttributeNames(names)
                .expressionAttributeValues(values)
                .build();

        try {
            dynamoDbClient.updateItem(req);
            return true;
        } catch (ConditionalCheckFailedException e) {
            return false;
        }
    }

    @Override
    public boolean updateFields(RequestItem item, RequestStatus expectedStatus, List<HistoryEntry> appendEntries) {
        Map<String, String> names = new HashMap<>();
        Map<String, AttributeValue> values = new HashMap<>();

        names.put("#status", ATTR_STATUS);
        values.put(":expected", s(expectedStatus.code()));

        StringBuilder set = new StringBuilder("SET ");
        names.put("#attributes", ATTR_ATTRIBUTES);
        values.put(":attributes", toAttrValue(item.getAttributes()));
        set.append("#attributes = :attributes");

        names.put("#updatedAt", ATTR_UPDATED_AT);
        values.put(":now", n(item.getUpdatedAt() == null ? 0L : item.getUpdatedAt()));
        set.append(", #updatedAt = :now");

        if (item.getClientName() != null) {
            names.put("#clientName", ATTR_CLIENT_NAME);
            values.put(":clientName", s(item.getClientName()));
            set.append(", #clientName = :clientName");
        }
        if (item.getBomFolderLink() != null) {
            names.put("#bomFolderLink", ATTR_BOM_FOLDER_LINK);
            values.put(":bomFolderLink", s(item.getBomFolderLink()));
            set.append(", #bomFolderLink = :bomFolderLink");
        }
        if (appendEntries != null && !appendEntries.isEmpty()) {
            names.put("#history", ATTR_HISTORY);
            values.put(":entries", historyValue(appendEntries));
            values.put(":empty", list(List.of()));
            set.append(", #history = list_append(if_not_exists(#history, :empty), :entries)");
        }

        try {
            dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(key(item.getRequestId()))
                    .conditionExpression("#status = :expected")
                    .updateExpression(set.toString())
                    .expressionAttributeNames(names)
                    .expressionAttributeValues(values)
                    .build());
            return true;
        } catch (ConditionalCheckFailedException e) {
            return false;
        }
    }

    @Override
    public Optional<String> findDraftIdBySession(String creatorId, String draftSessionKey) {
        Map<String, AttributeValue> key = Map.of(
                DdbKeyFactory.ATTR_PK, s(DdbKeyFactory.draftSessionPk(creatorId, draftSessionKey)),
                DdbKeyFactory.ATTR_SK, s(DdbKeyFactory.pointerSk())
        );

        Map<String, AttributeValue> item = dynamoDbClient.getItem(GetItemRequest.builder()
                .tableName(tableName)
                .key(key)
                .consistentRead(true)
                .build()).item();

        if (item == null || item.isEmpty()) return Optional.empty();
        return Optional.ofNullable(string(item, ATTR_POINTER_REQUEST_ID));
    }

    @Override
    public List<String> findDraftIdsBySession(String creatorId, String draftSessionKey) {
        List<String> ids = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;

        // GSI는 eventually consistent -> 삭제 시 status 조건으로 한 번 더 거른다
        do {
            QueryRequest.Builder req = QueryRequest.builder()
                    .tableName(tableName)
                    .indexName(DdbKeyFactory.GSI1)
                    .keyConditionExpression("#gpk = :gpk")
                    .filterExpression("#status = :draft")
                    .projectionExpression("#rid, #status")
                    .expressionAttributeNames(Map.of(
                            "#gpk", DdbKeyFactory.ATTR_GSI1_PK,
                            "#status", ATTR_STATUS,
                            "#rid", ATTR_REQUEST_ID
                    ))
                    .expressionAttributeValues(Map.of(
                            ":gpk", s(DdbKeyFactory.draftSessionPk(creatorId, draftSessionKey)),
                            ":draft", s(RequestStatus.DRAFT.code())
                    ));
            if (startKey != null) req.exclusiveStartKey(startKey);

            QueryResponse res = dynamoDbClient.query(req.build());
            for (Map<String, AttributeValue> item : res.items()) {
                String id = string(item, ATTR_REQUEST_ID);
                if (id != null) ids.add(id);
            }
            startKey = res.hasLastEvaluatedKey() && !res.lastEvaluatedKey().isEmpty()
                    ? res.lastEvaluatedKey()
                    : null;
        } while (startKey != null);

        return ids;
    }

    @Override
    public boolean deleteDraft(String requestId) {
        try {
            dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                    .tableName(tableName)
                    .key(key(requestId))
                    .conditionExpression("#status = :draft")
                    .expressionAttributeNames(Map.of("#status", ATTR_STATUS))
                    .expressionAttributeValues(Map.of(":draft", s(RequestStatus.DRAFT.code())))
                    .build());
            log.info("[DRAFT DELETED] requestId={}", requestId);
            return true;
        } catch (ConditionalCheckFailedException e) {
            return false;
        }
    }

    @Override
    public List<RequestItem> findAll() {
        List<RequestItem> result = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;

        do {
            ScanRequest.Builder req = ScanRequest.builder()
                    .tableName(tableName)
                    .filterExpression("begins_with(#pk, :prefix) AND #sk = :meta")
                    .expressionAttributeNames(Map.of(
                            "#pk", DdbKeyFactory.ATTR_PK,
                            "#sk", DdbKeyFactory.ATTR_SK
                    ))
                    .expressionAttributeValues(Map.of(
                            ":prefix", s(DdbKeyFactory.requestPkPrefix()),
                            ":meta", s(DdbKeyFactory.metaSk())
                    ));
            if (startKey != null) req.exclusiveStartKey(startKey);

            ScanResponse res = dynamoDbClient.scan(req.build());
            for (Map<String, AttributeValue> item : res.items()) {
                result.add(fromItem(item));
            }
            startKey = res.hasLastEvaluatedKey() && !res.lastEvaluatedKey().isEmpty()
                    ? res.lastEvaluatedKey()
                    : null;
        } while (startKey != null);

        return result;
    }
}
