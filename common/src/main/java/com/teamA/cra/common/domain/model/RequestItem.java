package com.teamA.cra.common.domain.model;

import com.teamA.cra.common.domain.enums.RequestStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request(케이스) 본체
 *
 * - status, history는 StateTransitionService를 통해서만 바뀐다
 * - 인스턴스는 불변으로 다루고, 변경은 toBuilder()로 새 객체를 만든다
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
public class RequestItem {

    // 식별자
    private String requestId;

    // 상태
    private RequestStatus status;

    // 생성자 / draft 세션 (중복 draft 방지용)
    private String createdBy;
    private String createdByName;
    private String draftSessionKey;

    // 케이스 필드 (엔진이 직접 보는 것만 타입으로 둠)
    private String clientName;
    private String bomFolderLink;

    // 그 외 케이스 필드 (country, applicationVehicle, expectedQty ...)
    @Builder.Default
    private Map<String, Object> attributes = Map.of();

    // 타임스탬프 (epoch millis)
    private Long createdAt;
    private Long updatedAt;

    @Builder.Default
    private List<HistoryEntry> history = List.of();

    public List<HistoryEntry> getHistory() {
        return history == null ? List.of() : Collections.unmodifiableList(history);
    }

    public Map<String, Object> getAttributes() {
        return attributes == null ? Map.of() : Collections.unmodifiableMap(attributes);
    }

    public Object attribute(String name) {
        return getAttributes().get(name);
    }

    public boolean hasDraftSession() {
        return createdBy != null && !createdBy.isBlank()
                && draftSessionKey != null && !draftSessionKey.isBlank();
    }

    public boolean hasBomFolderLink() {
        return bomFolderLink != null && !bomFolderLink.isBlank();
    }

    public boolean everHadStatus(RequestStatus target) {
        for (HistoryEntry entry : getHistory()) {
            if (entry.status() == target) return true;
        }
        return false;
    }

    /** 마지막 history 시각, 없으면 0 */
    public long lastHistoryTimestamp() {
        long max = 0L;
        for (HistoryEntry entry : getHistory()) {
            max = Math.max(max, entry.timestamp());
        }
        return max;
    }

    /**
     * 들어온 payload를 덮어쓴 새 RequestItem
     * - 새 값이 이긴다 (null은 무시)
     * - id / history / createdAt은 그대로 유지
     */
    public RequestItem mergedWith(RequestPayload payload, long now) {
        if (payload == null) return this.toBuilder().updatedAt(now).build();

        Map<String, Object> mergedAttributes = new LinkedHashMap<>(getAttributes());
        mergedAttributes.putAll(payload.getAttributes());

        return this.toBuilder()
                .clientName(payload.getClientName() != null ? payload.getClientName() : clientName)
                .bomFolderLink(payload.getBomFolderLink() != null ? payload.getBomFolderLink() : bomFolderLink)
                .attributes(mergedAttributes)
                .updatedAt(now)
                .build();
    }

    /** history에 entries를 붙이고 status를 바꾼 새 RequestItem */
    public RequestItem withTransition(RequestStatus newStatus, List<HistoryEntry> entries, long now) {
        List<HistoryEntry> appended = new ArrayList<>(getHistory());
        appended.addAll(entries);
        return this.toBuilder()
                .status(newStatus)
                .history(appended)
                .updatedAt(now)
                .build();
    }
}
