package com.teamA.cra.common.draft;

import com.teamA.cra.common.domain.model.RequestItem;

/**
 * created=false 면 기존 draft에 병합된 것
 */
public record DraftCreation(RequestItem request, boolean created) {
}
