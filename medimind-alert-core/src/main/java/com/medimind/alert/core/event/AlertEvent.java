package com.medimind.alert.core.event;

import com.medimind.alert.core.model.Alert;
import java.time.Instant;
import java.util.Objects;

/** Carries the full alert record as it was at emission time. */
public record AlertEvent(AlertEventType type, Alert alert, Instant emittedAt) {

    public AlertEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(alert, "alert");
        Objects.requireNonNull(emittedAt, "emittedAt");
    }
}
