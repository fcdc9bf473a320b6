package com.teamA.cra.common.marker;

import com.teamA.cra.common.support.FixedClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DynamoDailyMarkerStoreTest {

    private DynamoDbClient ddb;
    private DynamoDailyMarkerStore store;

    @BeforeEach
    void setUp() {
        ddb = mock(DynamoDbClient.class);
        store = new DynamoDailyMarkerStore(ddb, "cra-table", FixedClock.at("2026-10-18T06:00:00Z"));
    }

    @Test
    void shouldMarkOncePerNameAndDate() {
        assertThat(store.tryMark("integrity_alert_email", "2026-10-18")).isTrue();

        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(ddb).putItem(captor.capture());
        assertThat(captor.getValue().item().get("PK").s()).isEqualTo("MARKER#integrity_alert_email#2026-10-18");
        assertThat(captor.getValue().item().get("SK").s()).isEqualTo("ONCE");
        assertThat(captor.getValue().conditionExpression()).isEqualTo("attribute_not_exists(#pk)");
    }

    @Test
    void shouldReturnFalseWhenAlreadyMarked() {
        when(ddb.putItem(any(PutItemRequest.class)))
                .thenThrow(ConditionalCheckFailedException.builder().message("exists").build());

        assertThat(store.tryMark("integrity_alert_email", "2026-10-18")).isFalse();
    }

    @Test
    void shouldDeleteMarkerOnClear() {
        store.clear("integrity_alert_email", "2026-10-18");

        ArgumentCaptor<DeleteItemRequest> captor = ArgumentCaptor.forClass(DeleteItemRequest.class);
        verify(ddb).deleteItem(captor.capture());
        assertThat(captor.getValue().key().get("PK").s()).isEqualTo("MARKER#integrity_alert_email#2026-10-18");
    }
}
