package com.medimind.alert.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Resolution metadata recorded once, when an alert first reaches {@link AlertStatus#RESOLVED}. */
public record AlertResolution(Instant resolvedAt, String resolvedBy, Map<String, Object> details) {

    public AlertResolution {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
