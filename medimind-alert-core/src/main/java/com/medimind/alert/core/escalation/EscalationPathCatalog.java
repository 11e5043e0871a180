package com.medimind.alert.core.escalation;

import com.medimind.alert.core.delivery.DeliveryMethod;
import com.medimind.alert.core.rule.Severity;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class EscalationPathCatalog {

    private final Map<Severity, EscalationPath> paths;

    public EscalationPathCatalog(Map<Severity, List<EscalationStep>> steps) {
        Map<Severity, EscalationPath> built = new EnumMap<>(Severity.class);
        if (steps != null) {
            steps.forEach((severity, list) -> built.put(severity, new EscalationPath(severity, list)));
        }
        this.paths = Collections.unmodifiableMap(built);
    }

    public static EscalationPathCatalog defaults() {
        return new EscalationPathCatalog(defaultSteps());
    }

    static Map<Severity, List<EscalationStep>> defaultSteps() {
        Map<Severity, List<EscalationStep>> steps = new EnumMap<>(Severity.class);
        steps.put(
                Severity.CRITICAL,
                List.of(
                        EscalationStep.of(
                                DeliveryMethod.PUSH_NOTIFICATION, Duration.ZERO, "Immediate attention required"),
                        EscalationStep.of(
                                DeliveryMethod.SMS, Duration.ofSeconds(30), "Urgent: Medical attention needed"),
                        EscalationStep.of(
                                DeliveryMethod.PHONE_CALL, Duration.ofSeconds(60), "Emergency call initiated"),
                        EscalationStep.of(
                                DeliveryMethod.EMERGENCY_SERVICES,
                                Duration.ofSeconds(180),
                                "Contacting emergency services")));
        steps.put(
                Severity.WARNING,
                List.of(
                        EscalationStep.of(DeliveryMethod.PUSH_NOTIFICATION, Duration.ZERO, "Health alert"),
                        EscalationStep.of(DeliveryMethod.EMAIL, Duration.ofMinutes(5), "Health alert follow-up")));
        steps.put(
                Severity.INFO,
                List.of(EscalationStep.of(DeliveryMethod.IN_APP_NOTIFICATION, Duration.ZERO, "Health update")));
        return steps;
    }

    /** Returns a catalog where the given severities replace the current paths. */
    public EscalationPathCatalog withOverrides(Map<Severity, List<EscalationStep>> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<Severity, List<EscalationStep>> merged = new EnumMap<>(Severity.class);
        paths.forEach((severity, path) -> merged.put(severity, path.steps()));
        merged.putAll(overrides);
        return new EscalationPathCatalog(merged);
    }

    public EscalationPath path(Severity severity) {
        EscalationPath path = paths.get(severity);
        return path != null ? path : EscalationPath.empty(severity);
    }

    public Map<Severity, EscalationPath> paths() {
        return paths;
    }
}
