package com.teamA.cra.common.notification.digest;

import com.teamA.cra.common.domain.enums.NotificationEventType;
import com.teamA.cra.common.domain.enums.NotificationLanguage;
import com.teamA.cra.common.domain.enums.RequestStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class DynamoDigestQueueStoreTest {

    private DynamoDbClient ddb;
    private DynamoDigestQueueStore store;

    @BeforeEach
    void setUp() {
        ddb = mock(DynamoDbClient.class);
        store = new DynamoDigestQueueStore(ddb, "cra-table");
    }

    private Map<String, AttributeValue> enqueued() {
        ArgumentCaptor<PutItemRequest> put = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(ddb).putItem(put.capture());
        assertThat(put.getValue().tableName()).isEqualTo("cra-table");
        return put.getValue().item();
    }

    @Test
    void shouldStoreEntryUnderDateAndLanguagePartition() {
        store.enqueue(DigestQueueEntry.builder()
                .id("d-1")
                .eventType(NotificationEventType.REQUEST_STATUS_CHANGED)
                .requestId("CRA26101801")
                .status(RequestStatus.UNDER_REVIEW)
                .previousStatus(RequestStatus.SUBMITTED)
                .actorName("Dana Design")
                .toEmails(List.of("sales@acme.test", "design@acme.test"))
                .lang(NotificationLanguage.FR)
                .digestDate("2026-10-19")
                .eventAt(1_760_000_000_000L)
                .build());

        Map<String, AttributeValue> item = enqueued();
        assertThat(item.get("PK").s()).isEqualTo("DIGEST#2026-10-19#fr");
        assertThat(item.get("SK").s()).isEqualTo("EVT#1760000000000#d-1");
        assertThat(item.get("status").s()).isEqualTo("under_review");
        assertThat(item.get("previousStatus").s()).isEqualTo("submitted");
        assertThat(item.get("toEmails").l()).extracting(AttributeValue::s)
                .containsExactly("sales@acme.test", "design@acme.test");
        assertThat(item).doesNotContainKey("comment");
    }

    @Test
    void shouldOmitPreviousStatusForCreatedEventAndDefaultToBaseLanguage() {
        store.enqueue(DigestQueueEntry.builder()
                .id("d-2")
                .eventType(NotificationEventType.REQUEST_CREATED)
                .requestId("CRA26101802")
                .status(RequestStatus.SUBMITTED)
                .toEmails(List.of("design@acme.test"))
                .digestDate("2026-10-18")
                .eventAt(1L)
                .build());

        Map<String, AttributeValue> item = enqueued();
        assertThat(item.get("PK").s()).isEqualTo("DIGEST#2026-10-18#en");
        assertThat(item.get("eventType").s()).isEqualTo("request_created");
        assertThat(item).doesNotContainKey("previousStatus");
    }
}
