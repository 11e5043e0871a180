package com.medimind.alert.core.health;

import com.medimind.alert.core.store.AlertStore;
import com.medimind.alert.core.telemetry.AlertTelemetryRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class AlertHealthSummaryService {
    private final AlertStore store;
    private final AlertTelemetryRegistry telemetry;
    private final Clock clock;

    public AlertHealthSummaryService(AlertStore store, AlertTelemetryRegistry telemetry, Clock clock) {
        this.store = store;
        this.telemetry = telemetry;
        this.clock = clock;
    }

    public AlertHealthSummary summary() {
        AlertTelemetryRegistry.Snapshot snapshot = telemetry.snapshot();
        long stepsFired = snapshot.stepsFiredByMethod().values().stream()
                .mapToLong(Long::longValue)
                .sum();
        return new AlertHealthSummary(
                store.active(null).size(),
                store.acknowledged(null).size(),
                snapshot.created(),
                snapshot.merged(),
                snapshot.suppressed(),
                snapshot.createdBySeverity(),
                stepsFired,
                snapshot.stepsFiredByMethod(),
                snapshot.staleFires(),
                snapshot.deliveryFailures(),
                snapshot.unknownMethods(),
                snapshot.expired(),
                clock.instant());
    }

    public record AlertHealthSummary(
            long activeAlerts,
            long acknowledgedAlerts,
            long createdTotal,
            long mergedTotal,
            long suppressedTotal,
            Map<String, Long> createdBySeverity,
            long stepsFiredTotal,
            Map<String, Long> stepsFiredByMethod,
            long staleFiresTotal,
            long deliveryFailuresTotal,
            long unknownMethodsTotal,
            long expiredTotal,
            Instant generatedAt) {}
}
