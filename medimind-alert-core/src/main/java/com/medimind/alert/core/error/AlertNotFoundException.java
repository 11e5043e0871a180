package com.medimind.alert.core.error;

public class AlertNotFoundException extends RuntimeException {
    private final String alertId;

    public AlertNotFoundException(String alertId) {
        super("Alert not found: " + alertId);
        this.alertId = alertId;
    }

    public String alertId() {
        return alertId;
    }
}
