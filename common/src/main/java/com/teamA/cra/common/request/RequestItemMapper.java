package com.teamA.cra.common.request;

import com.teamA.cra.common.ddb.keys.DdbKeyFactory;
import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.model.HistoryEntry;
import com.teamA.cra.common.domain.model.RequestItem;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.teamA.cra.common.ddb.AttributeValues.*;

/**
 * RequestItem <-> DynamoDB item 변환
 *
 * status는 소문자 코드("gm_approval_pending")로 저장한다.
 */
final class RequestItemMapper {

    static final String ATTR_REQUEST_ID = "requestId";
    static final String ATTR_STATUS = "status";
    static final String ATTR_CREATED_BY = "createdBy";
    static final String ATTR_CREATED_BY_NAME = "createdByName";
    static final String ATTR_DRAFT_SESSION_KEY = "draftSessionKey";
    static final String ATTR_CLIENT_NAME = "clientName";
    static final String ATTR_BOM_FOLDER_LINK = "bomFolderLink";
    static final String ATTR_ATTRIBUTES = "attributes";
    static final String ATTR_CREATED_AT = "createdAt";
    static final String ATTR_UPDATED_AT = "updatedAt";
    static final String ATTR_HISTORY = "history";

    private static final String H_ID = "id";
    private static final String H_STATUS = "status";
    private static final String H_TIMESTAMP = "timestamp";
    private static final String H_ACTOR_ID = "actorId";
    private static final String H_ACTOR_NAME = "actorName";
    private static final String H_COMMENT = "comment";

    private RequestItemMapper() {
    }

    static Map<String, AttributeValue> key(String requestId) {
        return Map.of(
                DdbKeyFactory.ATTR_PK, s(DdbKeyFactory.requestPk(requestId)),
                DdbKeyFactory.ATTR_SK, s(DdbKeyFactory.metaSk())
        );
    }

    static Map<String, AttributeValue> toItem(RequestItem item) {
        if (item.getRequestId() == null || item.getStatus() == null) {
            throw new IllegalStateException("requestId/status must not be null");
        }

        Map<String, AttributeValue> map = new HashMap<>(key(item.getRequestId()));

        // 도메인 필드
        map.put(ATTR_REQUEST_ID, s(item.getRequestId()));
        map.put(ATTR_STATUS, s(item.getStatus().code()));
        putIfPresent(map, ATTR_CREATED_BY, item.getCreatedBy());
        putIfPresent(map, ATTR_CREATED_BY_NAME, item.getCreatedByName());
        putIfPresent(map, ATTR_DRAFT_SESSION_KEY, item.getDraftSessionKey());
        putIfPresent(map, ATTR_CLIENT_NAME, item.getClientName());
        putIfPresent(map, ATTR_BOM_FOLDER_LINK, item.getBomFolderLink());
        map.put(ATTR_ATTRIBUTES, toAttrValue(item.getAttributes()));
        putIfPresent(map, ATTR_CREATED_AT, item.getCreatedAt());
        putIfPresent(map, ATTR_UPDATED_AT, item.getUpdatedAt());
        map.put(ATTR_HISTORY, historyValue(item.getHistory()));

        // ✅ draft + 세션키일 때만 GSI1 세팅 (세션 내 draft 조회용)
        if (item.getStatus() == RequestStatus.DRAFT && item.hasDraftSession()) {
            long createdAt = item.getCreatedAt() == null ? 0L : item.getCreatedAt();
            map.put(DdbKeyFactory.ATTR_GSI1_PK,
                    s(DdbKeyFactory.draftSessionPk(item.getCreatedBy(), item.getDraftSessionKey())));
            map.put(DdbKeyFactory.ATTR_GSI1_SK,
                    s(DdbKeyFactory.draftSessionSk(createdAt, item.getRequestId())));
        }
        return map;
    }

    static RequestItem fromItem(Map<String, AttributeValue> item) {
        String statusCode = string(item, ATTR_STATUS);
        RequestStatus status = RequestStatus.fromCode(statusCode)
                .orElseThrow(() -> new IllegalStateException(
                        "Unknown persisted status: " + statusCode + " (" + string(item, ATTR_REQUEST_ID) + ")"));

        AttributeValue attrs = item.get(ATTR_ATTRIBUTES);

        return RequestItem.builder()
                .requestId(string(item, ATTR_REQUEST_ID))
                .status(status)
                .createdBy(string(item, ATTR_CREATED_BY))
                .createdByName(string(item, ATTR_CREATED_BY_NAME))
                .draftSessionKey(string(item, ATTR_DRAFT_SESSION_KEY))
                .clientName(string(item, ATTR_CLIENT_NAME))
                .bomFolderLink(string(item, ATTR_BOM_FOLDER_LINK))
                .attributes(attrs != null && attrs.hasM() ? fromAttrMap(attrs.m()) : Map.of())
                .createdAt(number(item, ATTR_CREATED_AT))
                .updatedAt(number(item, ATTR_UPDATED_AT))
                .history(historyFrom(item.get(ATTR_HISTORY)))
                .build();
    }

    static AttributeValue historyValue(List<HistoryEntry> entries) {
        List<AttributeValue> values = new ArrayList<>(entries.size());
        for (HistoryEntry entry : entries) {
            values.add(historyEntryValue(entry));
        }
        return list(values);
    }

    static AttributeValue historyEntryValue(HistoryEntry entry) {
        Map<String, AttributeValue> m = new HashMap<>();
        m.put(H_ID, s(entry.id()));
        m.put(H_STATUS, s(entry.status().code()));
        m.put(H_TIMESTAMP, n(entry.timestamp()));
        putIfPresent(m, H_ACTOR_ID, entry.actorId());
        putIfPresent(m, H_ACTOR_NAME, entry.actorName());
        if (entry.hasComment()) {
            m.put(H_COMMENT, s(entry.comment()));
        }
        return map(m);
    }

    private static List<HistoryEntry> historyFrom(AttributeValue value) {
        if (value == null || !value.hasL()) return List.of();

        List<HistoryEntry> entries = new ArrayList<>(value.l().size());
        for (AttributeValue v : value.l()) {
            Map<String, AttributeValue> m = v.m();
            String code = string(m, H_STATUS);
            RequestStatus status = RequestStatus.fromCode(code)
                    .orElseThrow(() -> new IllegalStateException("Unknown history status: " + code));
            entries.add(new HistoryEntry(
                    string(m, H_ID),
                    status,
                    number(m, H_TIMESTAMP, 0L),
                    string(m, H_ACTOR_ID),
                    string(m, H_ACTOR_NAME),
                    string(m, H_COMMENT)
            ));
        }
        return entries;
    }
}
