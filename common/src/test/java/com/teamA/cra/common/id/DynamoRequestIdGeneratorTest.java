package com.teamA.cra.common.id;

import com.teamA.cra.common.support.FixedClock;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DynamoRequestIdGeneratorTest {

    @Test
    void shouldPadSequenceToTwoDigits() {
        assertThat(DynamoRequestIdGenerator.format("CRA", "261018", 1)).isEqualTo("CRA26101801");
        assertThat(DynamoRequestIdGenerator.format("CRA", "261018", 123)).isEqualTo("CRA261018123");
    }

    @Test
    void shouldIncrementDailyCounter() {
        DynamoDbClient ddb = mock(DynamoDbClient.class);
        when(ddb.updateItem(any(UpdateItemRequest.class))).thenReturn(UpdateItemResponse.builder()
                .attributes(Map.of("seq", AttributeValue.builder().n("7").build()))
                .build());

        DynamoRequestIdGenerator generator = new DynamoRequestIdGenerator(
                ddb, "cra-table", FixedClock.at("2026-10-18T09:00:00Z"), ZoneOffset.UTC, "CRA");

        assertThat(generator.nextId()).isEqualTo("CRA26101807");

        ArgumentCaptor<UpdateItemRequest> captor = ArgumentCaptor.forClass(UpdateItemRequest.class);
        verify(ddb).updateItem(captor.capture());
        UpdateItemRequest req = captor.getValue();
        assertThat(req.tableName()).isEqualTo("cra-table");
        assertThat(req.key().get("PK").s()).isEqualTo("COUNTER#request_261018");
        assertThat(req.updateExpression()).isEqualTo("ADD #seq :one");
    }

    @Test
    void shouldStampDateInConfiguredZone() {
        DynamoDbClient ddb = mock(DynamoDbClient.class);
        when(ddb.updateItem(any(UpdateItemRequest.class))).thenReturn(UpdateItemResponse.builder()
                .attributes(Map.of("seq", AttributeValue.builder().n("1").build()))
                .build());

        // 23:30 UTC = 다음 날 01:30 Paris
        DynamoRequestIdGenerator generator = new DynamoRequestIdGenerator(
                ddb, "cra-table", FixedClock.at("2026-10-18T23:30:00Z"), ZoneId.of("Europe/Paris"), "CRA");

        assertThat(generator.nextId()).isEqualTo("CRA26101901");
    }
}
