package com.medimind.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import lombok.Data;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
public class ResolveRequest {

    /** Recorded as {@code resolvedBy}; ownership is not required. */
    @NotBlank
    private String userId;

    /** Free-form resolution details, e.g. {@code {"reason": "false alarm"}}. */
    private Map<String, Object> resolution;
}
