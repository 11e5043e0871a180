package com.medimind.alert.core.store;

import java.time.Instant;
import java.util.List;

public record ExpiryReport(
        Instant cutoff,
        int activeAlertsRemoved,
        int acknowledgedAlertsRemoved,
        int resolvedAlertsRemoved,
        List<String> removedAlertIds) {

    public ExpiryReport {
        removedAlertIds = removedAlertIds == null ? List.of() : List.copyOf(removedAlertIds);
    }

    public int total() {
        return activeAlertsRemoved + acknowledgedAlertsRemoved + resolvedAlertsRemoved;
    }
}
