package com.medimind.alert.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.medimind.alert.core.rule.Severity;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time view of an alert. Instances are immutable copies taken under the alert's lock;
 * timers are owned by the escalation scheduler and never appear here.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Alert(
        String id,
        String ruleId,
        String userId,
        Severity severity,
        String message,
        Map<String, Object> data,
        Instant createdAt,
        Instant updatedAt,
        AlertStatus status,
        boolean acknowledged,
        Instant acknowledgedAt,
        boolean requiresAcknowledgment,
        int escalationLevel,
        AlertResolution resolution) {

    public static final int NO_ESCALATION = -1;

    public Alert {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    @JsonIgnore
    public boolean isActive() {
        return status == AlertStatus.ACTIVE;
    }
}
