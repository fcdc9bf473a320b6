package com.teamA.cra.common.notification.settings;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamA.cra.common.ddb.keys.DdbKeyFactory;
import com.teamA.cra.common.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

import java.util.HashMap;
import java.util.Map;

import static com.teamA.cra.common.ddb.AttributeValues.*;

/**
 * 알림 설정 단일 item: PK = SETTINGS#NOTIFICATION, SK = META
 *
 * flowMap / templates 는 JSON 문자열로 저장 (관리 화면에서 자유 형식으로 편집)
 */
@Slf4j
@RequiredArgsConstructor
public class DynamoNotificationSettingsStore implements NotificationSettingsStore {

    private static final String ATTR_ENABLED = "enabled";
    private static final String ATTR_TRANSPORT_CONNECTED = "transportConnected";
    private static final String ATTR_SENDER = "senderAddress";
    private static final String ATTR_APP_BASE_URL = "appBaseUrl";
    private static final String ATTR_RECIPIENTS_SALES = "recipientsSales";
    private static final String ATTR_RECIPIENTS_DESIGN = "recipientsDesign";
    private static final String ATTR_RECIPIENTS_COSTING = "recipientsCosting";
    private static final String ATTR_RECIPIENTS_ADMIN = "recipientsAdmin";
    private static final String ATTR_TEST_MODE = "testMode";
    private static final String ATTR_TEST_EMAIL = "testEmail";
    private static final String ATTR_FLOW_MAP = "flowMapJson";
    private static final String ATTR_TEMPLATES = "templatesJson";
    private static final String ATTR_UPDATED_AT = "updatedAt";

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public NotificationSettings load() {
        Map<String, AttributeValue> item = dynamoDbClient.getItem(GetItemRequest.builder()
                .tableName(tableName)
                .key(key())
                .consistentRead(true)
                .build()).item();

        if (item == null || item.isEmpty()) {
            return NotificationSettings.disabled();
        }

        return NotificationSettings.builder()
                .enabled(bool(item, ATTR_ENABLED, false))
                .transportConnected(bool(item, ATTR_TRANSPORT_CONNECTED, false))
                .senderAddress(string(item, ATTR_SENDER))
                .appBaseUrl(string(item, ATTR_APP_BASE_URL))
                .recipientsSales(string(item, ATTR_RECIPIENTS_SALES))
                .recipientsDesign(string(item, ATTR_RECIPIENTS_DESIGN))
                .recipientsCosting(string(item, ATTR_RECIPIENTS_COSTING))
                .recipientsAdmin(string(item, ATTR_RECIPIENTS_ADMIN))
                .testMode(bool(item, ATTR_TEST_MODE, false))
                .testEmail(string(item, ATTR_TEST_EMAIL))
                .flowMap(FlowMaps.fromRaw(readJson(string(item, ATTR_FLOW_MAP), ATTR_FLOW_MAP)))
                .templates(new TemplateOverrides(readJson(string(item, ATTR_TEMPLATES), ATTR_TEMPLATES)))
                .updatedAt(number(item, ATTR_UPDATED_AT))
                .build();
    }

    @Override
    public void save(NotificationSettings settings) {
        Map<String, AttributeValue> item = new HashMap<>(key());
        item.put(ATTR_ENABLED, bool(settings.isEnabled()));
        item.put(ATTR_TRANSPORT_CONNECTED, bool(settings.isTransportConnected()));
        putIfPresent(item, ATTR_SENDER, trimmed(settings.getSenderAddress()));
        putIfPresent(item, ATTR_APP_BASE_URL, trimmed(settings.getAppBaseUrl()));
        putIfPresent(item, ATTR_RECIPIENTS_SALES, trimmed(settings.getRecipientsSales()));
        putIfPresent(item, ATTR_RECIPIENTS_DESIGN, trimmed(settings.getRecipientsDesign()));
        putIfPresent(item, ATTR_RECIPIENTS_COSTING, trimmed(settings.getRecipientsCosting()));
        putIfPresent(item, ATTR_RECIPIENTS_ADMIN, trimmed(settings.getRecipientsAdmin()));
        item.put(ATTR_TEST_MODE, bool(settings.isTestMode()));
        putIfPresent(item, ATTR_TEST_EMAIL, trimmed(settings.getTestEmail()));
        if (!settings.getFlowMap().isEmpty()) {
            item.put(ATTR_FLOW_MAP, s(writeJson(FlowMaps.toRaw(settings.getFlowMap()))));
        }
        if (!settings.getTemplates().isEmpty()) {
            item.put(ATTR_TEMPLATES, s(writeJson(settings.getTemplates().raw())));
        }
        item.put(ATTR_UPDATED_AT, n(clock.nowMillis()));

        dynamoDbClient.putItem(PutItemRequest.builder()
                .tableName(tableName)
                .item(item)
                .build());

        log.info("[SETTINGS SAVED] enabled={} testMode={} flowMapEntries={}",
                settings.isEnabled(), settings.isTestMode(), settings.getFlowMap().size());
    }

    private Map<String, AttributeValue> key() {
        return Map.of(
                DdbKeyFactory.ATTR_PK, s(DdbKeyFactory.settingsPk()),
                DdbKeyFactory.ATTR_SK, s(DdbKeyFactory.metaSk())
        );
    }

    private Map<String, Object> readJson(String json, String field) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, JSON_OBJECT);
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException e) {
            // 깨진 JSON은 "설정 없음"으로 취급
            log.warn("[SETTINGS] invalid JSON in {} ignored", field, e);
            return Map.of();
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize settings JSON", e);
        }
    }

    private static String trimmed(String value) {
        return value == null ? null : value.trim();
    }
}
