package com.teamA.cra.common.notification.template;

import com.teamA.cra.common.domain.enums.NotificationEventType;
import com.teamA.cra.common.domain.enums.NotificationLanguage;
import com.teamA.cra.common.domain.enums.RequestStatus;
import com.teamA.cra.common.domain.model.RequestItem;
import com.teamA.cra.common.notification.settings.NotificationSettings;
import com.teamA.cra.common.notification.settings.TemplateOverrides;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer();

    private TemplateVariables vars(NotificationLanguage lang) {
        RequestItem request = RequestItem.builder()
                .requestId("CRA26101801")
                .status(RequestStatus.SUBMITTED)
                .clientName("ACME <Motors>")
                .attributes(Map.of("country", "FR", "expectedQty", 1200))
                .updatedAt(1_792_310_400_000L)
                .build();
        return TemplateVariables.forRequest(request, "CRA26101801", RequestStatus.SUBMITTED, RequestStatus.DRAFT,
                lang, "Sam Sales", "please check");
    }

    private NotificationSettings settings(Map<String, Object> overrides) {
        return NotificationSettings.builder()
                .enabled(true)
                .transportConnected(true)
                .appBaseUrl("https://cra.example/")
                .templates(new TemplateOverrides(overrides))
                .build();
    }

    @Test
    void shouldRenderDefaultSubjectPerLanguage() {
        RenderedEmail en = renderer.render(settings(Map.of()), NotificationEventType.REQUEST_STATUS_CHANGED,
                NotificationLanguage.EN, vars(NotificationLanguage.EN));
        RenderedEmail fr = renderer.render(settings(Map.of()), NotificationEventType.REQUEST_CREATED,
                NotificationLanguage.FR, vars(NotificationLanguage.FR));

        assertThat(en.subject()).isEqualTo("[CRA] Request CRA26101801 status changed to Submitted");
        assertThat(fr.subject()).isEqualTo("[CRA] Demande CRA26101801 soumise");
    }

    @Test
    void shouldPreferLanguageKeyedOverrideOverLegacyShape() {
        Map<String, Object> overrides = Map.of(
                "en", Map.of("request_status_changed", Map.of("subject", "EN keyed {{requestId}}")),
                "request_status_changed", Map.of("subject", "Legacy {{requestId}}"));

        RenderedEmail email = renderer.render(settings(overrides), NotificationEventType.REQUEST_STATUS_CHANGED,
                NotificationLanguage.EN, vars(NotificationLanguage.EN));

        assertThat(email.subject()).isEqualTo("EN keyed CRA26101801");
    }

    @Test
    void shouldApplyLegacyOverrideToBaseLanguageOnly() {
        Map<String, Object> overrides = Map.of(
                "request_status_changed", Map.of("subject", "Legacy {{requestId}}"));

        RenderedEmail en = renderer.render(settings(overrides), NotificationEventType.REQUEST_STATUS_CHANGED,
                NotificationLanguage.EN, vars(NotificationLanguage.EN));
        RenderedEmail zh = renderer.render(settings(overrides), NotificationEventType.REQUEST_STATUS_CHANGED,
                NotificationLanguage.ZH, vars(NotificationLanguage.ZH));

        assertThat(en.subject()).isEqualTo("Legacy CRA26101801");
        assertThat(zh.subject()).startsWith("[CRA] 请求 CRA26101801");
    }

    @Test
    void shouldNeverProduceEmptySubject() {
        Map<String, Object> overrides = Map.of(
                "en", Map.of("request_created", Map.of("subject", "  {{nothing}} ")));

        RenderedEmail email = renderer.render(settings(overrides), NotificationEventType.REQUEST_CREATED,
                NotificationLanguage.EN, vars(NotificationLanguage.EN));

        assertThat(email.subject()).isEqualTo("[CRA] Request CRA26101801 submitted");
    }

    @Test
    void shouldSubstituteSinglePassAndBlankUnknownVariables() {
        String out = TemplateRenderer.apply("{{ a }}|{{b}}|{{missing}}", Map.of("a", "{{b}}", "b", "$1\\x"));

        assertThat(out).isEqualTo("{{b}}|$1\\x|");
    }

    @Test
    void shouldBlankPlaceholdersWithUnusualNames() {
        String out = TemplateRenderer.apply("Hi {{client-name}} / {{ requestId }} / {{a.b}}", Map.of("requestId", "CRA1"));

        assertThat(out).isEqualTo("Hi  / CRA1 / ");
    }

    @Test
    void shouldEscapeValuesAndLinkToRequest() {
        RenderedEmail email = renderer.render(settings(Map.of()), NotificationEventType.REQUEST_STATUS_CHANGED,
                NotificationLanguage.EN, vars(NotificationLanguage.EN));

        assertThat(email.html()).contains("ACME &lt;Motors&gt;");
        assertThat(email.html()).doesNotContain("ACME <Motors>");
        assertThat(email.html()).contains("https://cra.example/requests/CRA26101801");
        assertThat(email.html()).contains("please check");
        assertThat(email.html()).contains("1200");
    }

    @Test
    void shouldBuildLinksOnlyWithBaseUrl() {
        assertThat(TemplateRenderer.requestLink(null, "CRA1")).isEmpty();
        assertThat(TemplateRenderer.requestLink("https://cra.example//", "A B")).isEqualTo("https://cra.example/requests/A%20B");
        assertThat(TemplateRenderer.dashboardLink("https://cra.example")).isEqualTo("https://cra.example/dashboard");
    }

    @Test
    void shouldRenderIntegrityAlert() {
        RenderedEmail email = renderer.renderIntegrityAlert("https://cra.example", "2026-10-18", 3, 1);

        assertThat(email.subject()).isEqualTo("[CRA] Status integrity alert (3)");
        assertThat(email.html()).contains("2026-10-18").contains("https://cra.example/settings?tab=deployments");
    }
}
