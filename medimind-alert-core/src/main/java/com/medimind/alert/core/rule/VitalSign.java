package com.medimind.alert.core.rule;

import java.util.Locale;

/** Named vital readings a snapshot may carry. The wire key is the snapshot field name. */
public enum VitalSign {
    HEART_RATE("heart_rate"),
    BLOOD_PRESSURE_SYSTOLIC("blood_pressure_systolic"),
    BLOOD_PRESSURE_DIASTOLIC("blood_pressure_diastolic"),
    OXYGEN_SATURATION("oxygen_saturation"),
    TEMPERATURE("temperature"),
    RESPIRATORY_RATE("respiratory_rate");

    private final String wireKey;

    VitalSign(String wireKey) {
        this.wireKey = wireKey;
    }

    public String wireKey() {
        return wireKey;
    }

    public static VitalSign fromWireKey(String key) {
        if (key == null) {
            return null;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (VitalSign vital : values()) {
            if (vital.wireKey.equals(normalized)) {
                return vital;
            }
        }
        return null;
    }
}
