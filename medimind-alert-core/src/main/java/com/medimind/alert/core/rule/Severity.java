package com.medimind.alert.core.rule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Severity {
    CRITICAL,
    WARNING,
    INFO;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("severity must not be blank");
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
