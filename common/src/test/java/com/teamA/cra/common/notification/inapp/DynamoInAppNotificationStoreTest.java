package com.teamA.cra.common.notification.inapp;

import com.teamA.cra.common.support.FixedClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DynamoInAppNotificationStoreTest {

    private DynamoDbClient ddb;
    private DynamoInAppNotificationStore store;

    @BeforeEach
    void setUp() {
        ddb = mock(DynamoDbClient.class);
        store = new DynamoInAppNotificationStore(ddb, "cra-table", FixedClock.at("2026-10-18T09:00:00Z"));
    }

    private static InAppNotification notification(String id, boolean read) {
        return InAppNotification.builder()
                .id(id)
                .userId("u-admin")
                .type("request_status_changed")
                .title("Request CRA26101801")
                .body("Submitted")
                .requestId("CRA26101801")
                .payload(Map.of("actionPath", "/requests/CRA26101801", "count", 3L))
                .read(read)
                .createdAt(1_000L)
                .build();
    }

    @Test
    void shouldConvertItemBothWays() {
        InAppNotification original = notification("0000000001000-abcd1234", false);

        Map<String, AttributeValue> item = DynamoInAppNotificationStore.toItem(original);

        assertThat(item.get("PK").s()).isEqualTo("USER#u-admin");
        assertThat(item.get("SK").s()).isEqualTo("NOTI#0000000001000-abcd1234");
        assertThat(item.get("isRead").bool()).isFalse();
        assertThat(DynamoInAppNotificationStore.fromItem(item)).isEqualTo(original);
    }

    @Test
    void shouldListNewestFirstWithUnreadFilterAcrossPages() {
        Map<String, AttributeValue> lastKey = Map.of("PK", AttributeValue.builder().s("USER#u-admin").build());
        when(ddb.query(any(QueryRequest.class)))
                .thenReturn(QueryResponse.builder()
                        .items(List.of(DynamoInAppNotificationStore.toItem(notification("b", false))))
                        .lastEvaluatedKey(lastKey)
                        .build())
                .thenReturn(QueryResponse.builder()
                        .items(List.of(
                                DynamoInAppNotificationStore.toItem(notification("a", false)),
                                DynamoInAppNotificationStore.toItem(notification("0", false))))
                        .build());

        List<InAppNotification> unread = store.list("u-admin", true, 2);

        assertThat(unread).extracting(InAppNotification::id).containsExactly("b", "a");
        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(ddb, org.mockito.Mockito.times(2)).query(captor.capture());
        QueryRequest first = captor.getAllValues().get(0);
        assertThat(first.scanIndexForward()).isFalse();
        assertThat(first.filterExpression()).isEqualTo("#read = :false");
        assertThat(captor.getAllValues().get(1).exclusiveStartKey()).isEqualTo(lastKey);
    }

    @Test
    void shouldClampLimit() {
        assertThat(InAppNotificationStore.clampLimit(0)).isEqualTo(InAppNotificationStore.MIN_LIMIT);
        assertThat(InAppNotificationStore.clampLimit(1000)).isEqualTo(InAppNotificationStore.MAX_LIMIT);
    }

    @Test
    void shouldReportAlreadyReadAsNotUpdated() {
        when(ddb.updateItem(any(UpdateItemRequest.class)))
                .thenThrow(ConditionalCheckFailedException.builder().message("already read").build());

        assertThat(store.markRead("u-admin", "a")).isFalse();
    }

    @Test
    void shouldSetReadFlagAndTimestamp() {
        assertThat(store.markRead("u-admin", "a")).isTrue();

        ArgumentCaptor<UpdateItemRequest> captor = ArgumentCaptor.forClass(UpdateItemRequest.class);
        verify(ddb).updateItem(captor.capture());
        assertThat(captor.getValue().key().get("SK").s()).isEqualTo("NOTI#a");
        assertThat(captor.getValue().expressionAttributeValues().get(":now").n())
                .isEqualTo(Long.toString(FixedClock.at("2026-10-18T09:00:00Z").nowMillis()));
    }

    @Test
    void shouldInsertOnceWithMarkerInSameTransaction() {
        assertThat(store.insertOnce(notification("a", false), "integrity_alert_inapp", "2026-10-18")).isTrue();

        ArgumentCaptor<TransactWriteItemsRequest> captor = ArgumentCaptor.forClass(TransactWriteItemsRequest.class);
        verify(ddb).transactWriteItems(captor.capture());
        assertThat(captor.getValue().transactItems()).hasSize(2);
        assertThat(captor.getValue().transactItems().get(0).put().item().get("PK").s())
                .isEqualTo("MARKER#integrity_alert_inapp#2026-10-18");
        assertThat(captor.getValue().transactItems().get(0).put().item().get("SK").s()).isEqualTo("u-admin");
    }

    @Test
    void shouldReturnFalseWhenMarkerAlreadyExists() {
        when(ddb.transactWriteItems(any(TransactWriteItemsRequest.class))).thenThrow(TransactionCanceledException.builder()
                .cancellationReasons(
                        CancellationReason.builder().code("ConditionalCheckFailed").build(),
                        CancellationReason.builder().code("None").build())
                .build());

        assertThat(store.insertOnce(notification("a", false), "integrity_alert_inapp", "2026-10-18")).isFalse();
    }

    @Test
    void shouldPropagateOtherTransactionFailures() {
        when(ddb.transactWriteItems(any(TransactWriteItemsRequest.class))).thenThrow(TransactionCanceledException.builder()
                .cancellationReasons(CancellationReason.builder().code("ThrottlingError").build())
                .build());

        assertThatThrownBy(() -> store.insertOnce(notification("a", false), "integrity_alert_inapp", "2026-10-18"))
                .isInstanceOf(TransactionCanceledException.class);
    }
}
