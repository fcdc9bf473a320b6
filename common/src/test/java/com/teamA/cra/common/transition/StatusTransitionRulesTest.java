package com.teamA.cra.common.transition;

import com.teamA.cra.common.domain.enums.RequestStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatusTransitionRulesTest {

    private final StatusTransitionRules rules = new StatusTransitionRules();

    @Test
    void shouldKnowEveryStatusExceptEditedMarker() {
        assertThat(rules.isKnownStatus("submitted")).isTrue();
        assertThat(rules.isKnownStatus(" GM_APPROVAL_PENDING ")).isTrue();
        assertThat(rules.isKnownStatus("edited")).isFalse();
        assertThat(rules.isKnownStatus("archived")).isFalse();
        assertThat(rules.isKnownStatus(null)).isFalse();
    }

    @Test
    void shouldAllowListedTransitionsOnly() {
        assertThat(rules.isAllowedTransition(RequestStatus.DRAFT, RequestStatus.SUBMITTED)).isTrue();
        assertThat(rules.isAllowedTransition(RequestStatus.GM_APPROVAL_PENDING, RequestStatus.GM_REJECTED)).isTrue();
        assertThat(rules.isAllowedTransition(RequestStatus.DRAFT, RequestStatus.GM_APPROVED)).isFalse();
        assertThat(rules.isAllowedTransition(RequestStatus.CLOSED, RequestStatus.SUBMITTED)).isFalse();
    }

    @Test
    void shouldAllowSameStatusButNeverEdited() {
        assertThat(rules.isAllowedTransition(RequestStatus.UNDER_REVIEW, RequestStatus.UNDER_REVIEW)).isTrue();
        assertThat(rules.isAllowedTransition(RequestStatus.UNDER_REVIEW, RequestStatus.EDITED)).isFalse();
        assertThat(rules.isAllowedTransition(null, RequestStatus.SUBMITTED)).isFalse();
    }

    @Test
    void shouldExposeTerminalStatesWithoutSuccessors() {
        assertThat(rules.allowedTransitions(RequestStatus.CLOSED)).isEmpty();
        assertThat(rules.allowedTransitions(RequestStatus.CANCELLED)).isEmpty();
        assertThat(rules.allowedTransitions(RequestStatus.DRAFT))
                .containsExactlyInAnyOrder(RequestStatus.SUBMITTED, RequestStatus.CANCELLED);
    }
}
