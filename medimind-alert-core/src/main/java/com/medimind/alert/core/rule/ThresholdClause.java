package com.medimind.alert.core.rule;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Conjunction of bounds. Every bound must hold for the clause to match. */
public record ThresholdClause(List<ThresholdBound> allOf) {

    public ThresholdClause {
        if (allOf == null || allOf.isEmpty()) {
            throw new IllegalArgumentException("clause requires at least one bound");
        }
        allOf = List.copyOf(allOf);
    }

    public static ThresholdClause of(ThresholdBound... bounds) {
        return new ThresholdClause(List.of(bounds));
    }

    boolean matches(Map<VitalSign, Double> values) {
        for (ThresholdBound bound : allOf) {
            Double value = values.get(bound.vital());
            if (value == null || !bound.test(value)) {
                return false;
            }
        }
        return true;
    }

    Set<VitalSign> vitals() {
        Set<VitalSign> vitals = new LinkedHashSet<>();
        allOf.forEach(bound -> vitals.add(bound.vital()));
        return vitals;
    }
}
