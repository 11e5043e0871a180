package com.medimind.alert.core.store;

import com.medimind.alert.core.model.Alert;

public record AdmitResult(AdmitOutcome outcome, Alert alert) {

    public boolean isSuppressed() {
        return outcome == AdmitOutcome.SUPPRESSED;
    }
}
