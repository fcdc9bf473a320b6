package com.teamA.cra.api.web.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * status 비우면 draft
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class CreateRequestBody extends RequestPayloadBody {
    private String status;
    private String draftSessionKey;
}
