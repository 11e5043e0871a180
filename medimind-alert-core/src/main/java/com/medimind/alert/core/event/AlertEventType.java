package com.medimind.alert.core.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertEventType {
    /** New or merged alert. */
    ALERT("alert"),
    /** An escalation step fired. */
    ALERT_UPDATED("alertUpdated"),
    ALERT_ACKNOWLEDGED("alertAcknowledged"),
    ALERT_RESOLVED("alertResolved");

    private final String wireName;

    AlertEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
