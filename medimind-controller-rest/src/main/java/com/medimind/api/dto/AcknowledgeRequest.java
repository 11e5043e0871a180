package com.medimind.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AcknowledgeRequest {

    /** Must own the alert. */
    @NotBlank
    private String userId;
}
