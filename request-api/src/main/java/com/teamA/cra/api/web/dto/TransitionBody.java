package com.teamA.cra.api.web.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class TransitionBody {
    @NotBlank
    private String status;
    private String comment;
}
