package com.teamA.cra.common.request;

import com.teamA.cra.common.domain.model.RequestItem;
import com.teamA.cra.common.notification.DispatchOutcome;

public record CreatedRequest(RequestItem request, boolean created, DispatchOutcome notification) {
}
