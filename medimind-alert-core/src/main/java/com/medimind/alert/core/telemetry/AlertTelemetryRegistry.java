package com.medimind.alert.core.telemetry;

import com.medimind.alert.core.rule.Severity;
import com.medimind.alert.core.store.AdmitOutcome;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

@Component
@Primary
public class AlertTelemetryRegistry implements AlertTelemetry {
    private final Map<AdmitOutcome, LongAdder> admissions = new EnumMap<>(AdmitOutcome.class);
    private final Map<Severity, LongAdder> createdBySeverity = new EnumMap<>(Severity.class);
    private final Map<String, LongAdder> stepsFiredByMethod = new ConcurrentHashMap<>();
    private final LongAdder staleFires = new LongAdder();
    private final LongAdder deliveryFailures = new LongAdder();
    private final LongAdder unknownMethods = new LongAdder();
    private final LongAdder expired = new LongAdder();

    public AlertTelemetryRegistry() {
        for (AdmitOutcome outcome : AdmitOutcome.values()) {
            admissions.put(outcome, new LongAdder());
        }
        for (Severity severity : Severity.values()) {
            createdBySeverity.put(severity, new LongAdder());
        }
    }

    @Override
    public void recordAdmission(AdmitOutcome outcome, Severity severity) {
        if (outcome == null) {
            return;
        }
        admissions.get(outcome).increment();
        if (outcome == AdmitOutcome.CREATED && severity != null) {
            createdBySeverity.get(severity).increment();
        }
    }

    @Override
    public void recordStepFired(String method) {
        stepsFiredByMethod.computeIfAbsent(method, m -> new LongAdder()).increment();
    }

    @Override
    public void recordStaleFire() {
        staleFires.increment();
    }

    @Override
    public void recordDeliveryFailure(String method) {
        deliveryFailures.increment();
    }

    @Override
    public void recordUnknownMethod(String method) {
        unknownMethods.increment();
    }

    @Override
    public void recordExpired(int count) {
        if (count > 0) {
            expired.add(count);
        }
    }

    public Snapshot snapshot() {
        Map<String, Long> steps = new TreeMap<>();
        stepsFiredByMethod.forEach((method, adder) -> steps.put(method, adder.sum()));
        Map<String, Long> created = new LinkedHashMap<>();
        createdBySeverity.forEach((severity, adder) -> created.put(severity.wireValue(), adder.sum()));
        return new Snapshot(
                admissions.get(AdmitOutcome.CREATED).sum(),
                admissions.get(AdmitOutcome.MERGED).sum(),
                admissions.get(AdmitOutcome.SUPPRESSED).sum(),
                created,
                steps,
                staleFires.sum(),
                deliveryFailures.sum(),
                unknownMethods.sum(),
                expired.sum());
    }

    public record Snapshot(
            long created,
            long merged,
            long suppressed,
            Map<String, Long> createdBySeverity,
            Map<String, Long> stepsFiredByMethod,
            long staleFires,
            long deliveryFailures,
            long unknownMethods,
            long expired) {}
}
