package com.medimind.alert.core.error;

/** Raised when a user acts on an alert that belongs to someone else. */
public class AlertAccessDeniedException extends RuntimeException {
    private final String alertId;
    private final String userId;

    public AlertAccessDeniedException(String alertId, String userId) {
        super("User " + userId + " is not authorized to acknowledge alert " + alertId);
        this.alertId = alertId;
        this.userId = userId;
    }

    public String alertId() {
        return alertId;
    }

    public String userId() {
        return userId;
    }
}
