package com.teamA.cra.common.notification.template;

import com.teamA.cra.common.domain.enums.NotificationLanguage;
import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.model.RequestItem;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateVariablesTest {

    @Test
    void shouldExposeLabelsAndCodes() {
        RequestItem request = RequestItem.builder()
                .requestId("CRA26101801")
                .clientName(" ACME ")
                .attributes(Map.of("expectedQty", "lots", "clientExpectedDeliveryDate", "2027-01-15"))
                .createdAt(0L)
                .updatedAt(1_000L)
                .build();

        TemplateVariables vars = TemplateVariables.forRequest(request, null, RequestStatus.SUBMITTED, null,
                NotificationLanguage.FR, "Sam", null);

        assertThat(vars.get("requestId")).isEqualTo("CRA26101801");
        assertThat(vars.get("status")).isEqualTo("Soumis");
        assertThat(vars.get("statusCode")).isEqualTo("submitted");
        assertThat(vars.get("previousStatus")).isEmpty();
        assertThat(vars.get("client")).isEqualTo("ACME");
        assertThat(vars.get("expectedQty")).isEmpty();
        assertThat(vars.get("expectedDeliveryDate")).isEqualTo("2027-01-15");
        assertThat(vars.get("updatedAt")).isEqualTo("1970-01-01 00:00:01 UTC");
        assertThat(vars.get("nope")).isEmpty();
        assertThat(vars.comment()).isEmpty();
    }

    @Test
    void shouldHumanizeUnlabelledCodes() {
        assertThat(EmailStrings.humanize("gm_approval_pending")).isEqualTo("Gm Approval Pending");
        assertThat(EmailStrings.forLanguage(NotificationLanguage.EN).statusLabel("mystery_state")).isEqualTo("Mystery State");
    }
}
