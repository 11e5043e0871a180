package com.medimind.alert.core.rule;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Disjunction of {@link ThresholdClause}s. The condition holds when any clause matches.
 *
 * <p>Conditions are plain data so catalogs can be inspected, serialized and compared in tests.
 */
public record RuleCondition(List<ThresholdClause> anyOf) {

    public RuleCondition {
        if (anyOf == null || anyOf.isEmpty()) {
            throw new IllegalArgumentException("condition requires at least one clause");
        }
        anyOf = List.copyOf(anyOf);
    }

    public static RuleCondition anyOf(ThresholdClause... clauses) {
        return new RuleCondition(List.of(clauses));
    }

    public static RuleCondition single(VitalSign vital, Comparison comparison, double threshold) {
        return anyOf(ThresholdClause.of(ThresholdBound.of(vital, comparison, threshold)));
    }

    public boolean matches(Map<VitalSign, Double> values) {
        for (ThresholdClause clause : anyOf) {
            if (clause.matches(values)) {
                return true;
            }
        }
        return false;
    }

    /** Vitals referenced anywhere in the condition, in declaration order. */
    public Set<VitalSign> vitals() {
        Set<VitalSign> vitals = new LinkedHashSet<>();
        anyOf.forEach(clause -> vitals.addAll(clause.vitals()));
        return Collections.unmodifiableSet(vitals);
    }
}
