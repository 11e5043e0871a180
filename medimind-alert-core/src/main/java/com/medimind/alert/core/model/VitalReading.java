package com.medimind.alert.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One reading from the ingestion pipeline. The value is kept raw; numeric conversion happens at
 * evaluation time so a malformed value only affects its own vital.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VitalReading(Object value, String unit) {

    public static VitalReading of(Object value) {
        return new VitalReading(value, null);
    }
}
