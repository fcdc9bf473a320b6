package com.teamA.cra.common.notification.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;

import java.util.Map;

/**
 * outbox = SQS 큐, entry 하나 = JSON 메시지 하나
 */
@Slf4j
@RequiredArgsConstructor
public class SqsOutboxPublisher implements OutboxPublisher {

    private final SqsClient sqsClient;
    private final String queueUrl;
    private final ObjectMapper objectMapper;

    @Override
    public void publish(OutboxEntry entry) {
        String body;
        try {
            body = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new OutboxPublishException("Failed to serialize outbox entry " + entry.id(), e);
        }

        try {
            sqsClient.sendMessage(r -> r
                    .queueUrl(queueUrl)
                    .messageBody(body)
                    .messageAttributes(Map.of("eventType", MessageAttributeValue.builder()
                            .dataType("String")
                            .stringValue(entry.eventType())
                            .build()))
            );
        } catch (SdkException e) {
            throw new OutboxPublishException("Failed to enqueue outbox entry " + entry.id(), e);
        }

        log.info("[OUTBOX] id={} requestId={} eventType={} to={}",
                entry.id(), entry.requestId(), entry.eventType(), entry.toEmails().size());
    }
}
