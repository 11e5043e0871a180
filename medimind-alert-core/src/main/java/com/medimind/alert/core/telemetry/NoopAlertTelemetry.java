package com.medimind.alert.core.telemetry;

import com.medimind.alert.core.rule.Severity;
import com.medimind.alert.core.store.AdmitOutcome;

public class NoopAlertTelemetry implements AlertTelemetry {
    @Override
    public void recordAdmission(AdmitOutcome outcome, Severity severity) {}

    @Override
    public void recordStepFired(String method) {}

    @Override
    public void recordStaleFire() {}

    @Override
    public void recordDeliveryFailure(String method) {}

    @Override
    public void recordUnknownMethod(String method) {}

    @Override
    public void recordExpired(int count) {}
}
