package com.medimind.alert.core.rule;

import static com.medimind.alert.core.rule.Comparison.GREATER_THAN;
import static com.medimind.alert.core.rule.Comparison.GREATER_THAN_OR_EQUAL;
import static com.medimind.alert.core.rule.Comparison.LESS_THAN;
import static com.medimind.alert.core.rule.Comparison.LESS_THAN_OR_EQUAL;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static table of threshold rules, grouped by vital group in evaluation order.
 * Within a group the rules are kept in declaration order, so critical rules are declared first.
 */
public final class RuleCatalog {

    public static final String HEART_RATE_CRITICAL = "heart_rate_critical";
    public static final String HEART_RATE_WARNING = "heart_rate_warning";
    public static final String BLOOD_PRESSURE_CRITICAL = "blood_pressure_critical";
    public static final String OXYGEN_SATURATION_CRITICAL = "oxygen_saturation_critical";
    public static final String TEMPERATURE_HIGH = "temperature_high";

    private final Map<String, AlertRule> byId;
    private final Map<String, List<AlertRule>> byGroup;

    public RuleCatalog(List<AlertRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("rule catalog must not be empty");
        }
        Map<String, AlertRule> ids = new LinkedHashMap<>();
        Map<String, List<AlertRule>> groups = new LinkedHashMap<>();
        for (AlertRule rule : rules) {
            if (ids.putIfAbsent(rule.id(), rule) != null) {
                throw new IllegalArgumentException("duplicate rule id: " + rule.id());
            }
            groups.computeIfAbsent(rule.group(), g -> new ArrayList<>()).add(rule);
        }
        this.byId = Collections.unmodifiableMap(ids);
        Map<String, List<AlertRule>> frozen = new LinkedHashMap<>();
        groups.forEach((group, list) -> frozen.put(group, List.copyOf(list)));
        this.byGroup = Collections.unmodifiableMap(frozen);
    }

    public static RuleCatalog defaults() {
        List<AlertRule> rules = List.of(
                new AlertRule(
                        HEART_RATE_CRITICAL,
                        "heart_rate",
                        RuleCondition.anyOf(
                                ThresholdClause.of(ThresholdBound.of(VitalSign.HEART_RATE, LESS_THAN, 40)),
                                ThresholdClause.of(ThresholdBound.of(VitalSign.HEART_RATE, GREATER_THAN, 150))),
                        Severity.CRITICAL,
                        "Critical heart rate detected",
                        "HR < 40 or > 150 bpm",
                        true,
                        Duration.ofMinutes(1)),
                new AlertRule(
                        HEART_RATE_WARNING,
                        "heart_rate",
                        RuleCondition.anyOf(
                                ThresholdClause.of(
                                        ThresholdBound.of(VitalSign.HEART_RATE, GREATER_THAN, 100),
                                        ThresholdBound.of(VitalSign.HEART_RATE, LESS_THAN_OR_EQUAL, 120)),
                                ThresholdClause.of(
                                        ThresholdBound.of(VitalSign.HEART_RATE, GREATER_THAN_OR_EQUAL, 50),
                                        ThresholdBound.of(VitalSign.HEART_RATE, LESS_THAN, 60))),
                        Severity.WARNING,
                        "Abnormal heart rate detected",
                        "50 <= HR < 60 or 100 < HR <= 120 bpm",
                        false,
                        Duration.ofMinutes(5)),
                new AlertRule(
                        BLOOD_PRESSURE_CRITICAL,
                        "blood_pressure",
                        RuleCondition.anyOf(
                                ThresholdClause.of(
                                        ThresholdBound.of(VitalSign.BLOOD_PRESSURE_SYSTOLIC, GREATER_THAN, 180)),
                                ThresholdClause.of(
                                        ThresholdBound.of(VitalSign.BLOOD_PRESSURE_DIASTOLIC, GREATER_THAN, 120))),
                        Severity.CRITICAL,
                        "Hypertensive crisis detected",
                        "SYS > 180 or DIA > 120",
                        true,
                        Duration.ofSeconds(30)),
                new AlertRule(
                        OXYGEN_SATURATION_CRITICAL,
                        "oxygen_saturation",
                        RuleCondition.single(VitalSign.OXYGEN_SATURATION, LESS_THAN, 88),
                        Severity.CRITICAL,
                        "Critical oxygen saturation",
                        "SpO2 < 88%",
                        true,
                        Duration.ofSeconds(30)),
                new AlertRule(
                        TEMPERATURE_HIGH,
                        "temperature",
                        RuleCondition.single(VitalSign.TEMPERATURE, GREATER_THAN, 38.0),
                        Severity.WARNING,
                        "Elevated body temperature",
                        "> 38.0°C (100.4°F)",
                        false,
                        Duration.ofMinutes(5)));
        return new RuleCatalog(rules);
    }

    public AlertRule rule(String id) {
        AlertRule rule = byId.get(id);
        if (rule == null) {
            throw new IllegalArgumentException("Unknown rule: " + id);
        }
        return rule;
    }

    public Optional<AlertRule> find(String id) {
        return Optional.ofNullable(id == null ? null : byId.get(id));
    }

    public List<AlertRule> rules() {
        return List.copyOf(byId.values());
    }

    /** Rule groups in evaluation order; each list is ordered by priority. */
    public Map<String, List<AlertRule>> groups() {
        return byGroup;
    }
}
