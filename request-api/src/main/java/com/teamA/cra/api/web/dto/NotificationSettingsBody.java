package com.teamA.cra.api.web.dto;

import com.teamA.cra.common.notification.settings.FlowMaps;
import com.teamA.cra.common.notification.settings.NotificationSettings;
import com.teamA.cra.common.notification.settings.TemplateOverrides;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 관리 화면 편집 단위
 *
 * recipients* 는 자유 텍스트 (쉼표 / 세미콜론 / 줄바꿈 구분)
 */
@Data
public class NotificationSettingsBody {
    private boolean enabled;
    private boolean transportConnected;
    private String senderAddress;
    private String appBaseUrl;
    private String recipientsSales;
    private String recipientsDesign;
    private String recipientsCosting;
    private String recipientsAdmin;
    private boolean testMode;
    private String testEmail;
    private Map<String, Object> flowMap;
    private Map<String, Object> templates;
    private Long updatedAt;

    public static NotificationSettingsBody from(NotificationSettings settings) {
        NotificationSettingsBody body = new NotificationSettingsBody();
        body.setEnabled(settings.isEnabled());
        body.setTransportConnected(settings.isTransportConnected());
        body.setSenderAddress(settings.getSenderAddress());
        body.setAppBaseUrl(settings.getAppBaseUrl());
        body.setRecipientsSales(settings.getRecipientsSales());
        body.setRecipientsDesign(settings.getRecipientsDesign());
        body.setRecipientsCosting(settings.getRecipientsCosting());
        body.setRecipientsAdmin(settings.getRecipientsAdmin());
        body.setTestMode(settings.isTestMode());
        body.setTestEmail(settings.getTestEmail());
        body.setFlowMap(new LinkedHashMap<>(FlowMaps.toRaw(settings.getFlowMap())));
        body.setTemplates(settings.getTemplates().raw());
        body.setUpdatedAt(settings.getUpdatedAt());
        return body;
    }

    public NotificationSettings toSettings() {
        return NotificationSettings.builder()
                .enabled(enabled)
                .transportConnected(transportConnected)
                .senderAddress(senderAddress)
                .appBaseUrl(appBaseUrl)
                .recipientsSales(recipientsSales)
                .recipientsDesign(recipientsDesign)
                .recipientsCosting(recipientsCosting)
                .recipientsAdmin(recipientsAdmin)
                .testMode(testMode)
                .testEmail(testEmail)
                .flowMap(FlowMaps.fromRaw(flowMap == null ? Map.of() : flowMap))
                .templates(templates == null ? TemplateOverrides.EMPTY : new TemplateOverrides(templates))
                .build();
    }
}
