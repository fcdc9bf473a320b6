package com.teamA.cra.common.request;

import com.teamA.cra.common.domain.model.RequestItem;
import com.teamA.cra.common.notification.DispatchOutcome;

public record EditedRequest(RequestItem request, DispatchOutcome notification) {
}
