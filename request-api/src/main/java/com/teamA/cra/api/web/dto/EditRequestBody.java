package com.teamA.cra.api.web.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class EditRequestBody extends RequestPayloadBody {
    private boolean markEdited;
    private boolean renotify;
}
