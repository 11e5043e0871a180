package com.medimind.alert.core.evaluate;

import com.medimind.alert.core.error.InvalidSnapshotException;
import com.medimind.alert.core.model.VitalReading;
import com.medimind.alert.core.model.VitalsSnapshot;
import com.medimind.alert.core.rule.AlertRule;
import com.medimind.alert.core.rule.RuleCatalog;
import com.medimind.alert.core.rule.VitalSign;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Applies the rule catalog to a vitals snapshot. Pure: no state, no side effects beyond logging.
 *
 * <p>Rules compete per vital group. Inside a group the first rule whose condition holds wins, so a
 * reading never raises both the critical and the warning alert of the same vital.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertEvaluator {

    private final RuleCatalog catalog;

    public List<AlertCandidate> evaluate(VitalsSnapshot snapshot, String userId) {
        if (snapshot == null || snapshot.isEmpty() || userId == null) {
            return List.of();
        }
        List<AlertCandidate> candidates = new ArrayList<>();
        for (Map.Entry<String, List<AlertRule>> group : catalog.groups().entrySet()) {
            evaluateGroup(group.getKey(), group.getValue(), snapshot, userId).ifPresent(candidates::add);
        }
        return candidates.isEmpty() ? List.of() : List.copyOf(candidates);
    }

    private Optional<AlertCandidate> evaluateGroup(
            String group, List<AlertRule> rules, VitalsSnapshot snapshot, String userId) {
        Map<VitalSign, Double> values = new EnumMap<>(VitalSign.class);
        for (VitalSign vital : groupVitals(rules)) {
            Optional<VitalReading> reading = snapshot.reading(vital);
            if (reading.isEmpty() || reading.get().value() == null) {
                continue;
            }
            try {
                values.put(vital, numeric(vital, reading.get().value()));
            } catch (InvalidSnapshotException ex) {
                log.warn("Skipping {} evaluation for user {}: {}", group, userId, ex.getMessage());
                return Optional.empty();
            }
        }
        if (values.isEmpty()) {
            return Optional.empty();
        }
        for (AlertRule rule : rules) {
            if (!values.keySet().containsAll(rule.vitals())) {
                continue;
            }
            if (rule.condition().matches(values)) {
                return Optional.of(new AlertCandidate(rule, userId, payload(rule, values)));
            }
        }
        return Optional.empty();
    }

    private static Set<VitalSign> groupVitals(List<AlertRule> rules) {
        Set<VitalSign> vitals = new LinkedHashSet<>();
        rules.forEach(rule -> vitals.addAll(rule.vitals()));
        return vitals;
    }

    private static Map<String, Object> payload(AlertRule rule, Map<VitalSign, Double> values) {
        Map<String, Object> data = new LinkedHashMap<>();
        Set<VitalSign> vitals = rule.vitals();
        if (vitals.size() == 1) {
            data.put("value", values.get(vitals.iterator().next()));
        } else {
            vitals.forEach(vital -> data.put(vital.wireKey(), values.get(vital)));
        }
        if (rule.thresholdDescription() != null) {
            data.put("threshold", rule.thresholdDescription());
        }
        data.put("severity", rule.severity().wireValue());
        return data;
    }

    static double numeric(VitalSign vital, Object raw) {
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof String text) {
            try {
                value = Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                throw new InvalidSnapshotException(vital.wireKey(), raw, ex);
            }
        } else {
            throw new InvalidSnapshotException(vital.wireKey(), raw);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidSnapshotException(vital.wireKey(), raw);
        }
        return value;
    }
}
