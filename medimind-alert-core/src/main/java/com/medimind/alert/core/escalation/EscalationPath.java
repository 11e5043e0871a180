package com.medimind.alert.core.escalation;

import com.medimind.alert.core.rule.Severity;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/** Steps for one severity, sorted by cumulative delay. */
public record EscalationPath(Severity severity, List<EscalationStep> steps) {

    public EscalationPath {
        Objects.requireNonNull(severity, "severity");
        steps = steps == null
                ? List.of()
                : steps.stream()
                        .sorted(Comparator.comparing(EscalationStep::delay))
                        .toList();
    }

    public static EscalationPath empty(Severity severity) {
        return new EscalationPath(severity, List.of());
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int size() {
        return steps.size();
    }

    public EscalationStep step(int index) {
        return steps.get(index);
    }
}
