package com.teamA.cra.common.notification.settings;

import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.enums.Role;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 알림 정책 (단일 item)
 *
 * recipients* 는 관리자가 입력한 원문 그대로 (파싱은 recipientsFor)
 */
@Getter
@Builder(toBuilder = true)
public class NotificationSettings {

    private final boolean enabled;

    // 메일 발송 수단 연결 여부 (외부 sender가 갱신)
    private final boolean transportConnected;

    private final String senderAddress;
    private final String appBaseUrl;

    private final String recipientsSales;
    private final String recipientsDesign;
    private final String recipientsCosting;
    private final String recipientsAdmin;

    @Builder.Default
    private final Map<RequestStatus, RoleFlags> flowMap = Map.of();

    private final boolean testMode;
    private final String testEmail;

    @Builder.Default
    private final TemplateOverrides templates = TemplateOverrides.EMPTY;

    private final Long updatedAt;

    public static NotificationSettings disabled() {
        return NotificationSettings.builder().build();
    }

    public Map<RequestStatus, RoleFlags> getFlowMap() {
        return flowMap == null ? Map.of() : Collections.unmodifiableMap(flowMap);
    }

    public TemplateOverrides getTemplates() {
        return templates == null ? TemplateOverrides.EMPTY : templates;
    }

    public List<String> recipientsFor(Role role) {
        return switch (role) {
            case SALES -> EmailAddresses.parse(recipientsSales);
            case DESIGN -> EmailAddresses.parse(recipientsDesign);
            case COSTING -> EmailAddresses.parse(recipientsCosting);
            case ADMIN -> EmailAddresses.parse(recipientsAdmin);
        };
    }

    /** test 모드 수신 주소: testEmail, 없으면 발신 주소 */
    public List<String> testRecipients() {
        List<String> test = EmailAddresses.parse(testEmail);
        return test.isEmpty() ? EmailAddresses.parse(senderAddress) : test;
    }
}
