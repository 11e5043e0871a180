package com.medimind.alert.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isLive() {
        return this != RESOLVED;
    }
}
