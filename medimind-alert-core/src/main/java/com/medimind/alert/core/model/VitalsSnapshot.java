package com.medimind.alert.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.medimind.alert.core.rule.VitalSign;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Vitals snapshot as produced by the ingestion pipeline:
 * {@code { userId, heart_rate: {value}, blood_pressure_systolic: {value}, ... }}.
 *
 * <p>Every field other than {@code userId} is kept as a reading. Readings may be given either as
 * {@code {value, unit}} objects or as bare scalars.
 */
public final class VitalsSnapshot {

    @JsonProperty("userId")
    private String userId;

    private final Map<String, VitalReading> readings = new LinkedHashMap<>();

    private VitalsSnapshot() {}

    public static Builder builder() {
        return new Builder();
    }

    public String userId() {
        return userId;
    }

    @JsonAnyGetter
    public Map<String, VitalReading> readings() {
        return Collections.unmodifiableMap(readings);
    }

    @JsonIgnore
    public Optional<VitalReading> reading(VitalSign vital) {
        return Optional.ofNullable(readings.get(vital.wireKey()));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return readings.isEmpty();
    }

    @JsonAnySetter
    void bindReading(String name, Object raw) {
        if (name == null || raw == null) {
            return;
        }
        if (raw instanceof Map<?, ?> map) {
            Object unit = map.get("unit");
            readings.put(name, new VitalReading(map.get("value"), unit == null ? null : unit.toString()));
        } else {
            readings.put(name, VitalReading.of(raw));
        }
    }

    @Override
    public String toString() {
        return "VitalsSnapshot{userId=" + userId + ", readings=" + readings + "}";
    }

    public static final class Builder {
        private String userId;
        private final Map<String, VitalReading> readings = new LinkedHashMap<>();

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder reading(VitalSign vital, Object value) {
            return reading(vital.wireKey(), VitalReading.of(value));
        }

        public Builder reading(String name, VitalReading reading) {
            readings.put(name, reading);
            return this;
        }

        public VitalsSnapshot build() {
            VitalsSnapshot snapshot = new VitalsSnapshot();
            snapshot.userId = userId;
            snapshot.readings.putAll(readings);
            return snapshot;
        }
    }
}
