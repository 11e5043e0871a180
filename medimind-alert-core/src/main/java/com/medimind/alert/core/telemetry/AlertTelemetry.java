package com.medimind.alert.core.telemetry;

import com.medimind.alert.core.rule.Severity;
import com.medimind.alert.core.store.AdmitOutcome;

public interface AlertTelemetry {
    void recordAdmission(AdmitOutcome outcome, Severity severity);

    void recordStepFired(String method);

    void recordStaleFire();

    void recordDeliveryFailure(String method);

    void recordUnknownMethod(String method);

    void recordExpired(int count);
}
