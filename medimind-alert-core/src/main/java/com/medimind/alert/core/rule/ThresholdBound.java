package com.medimind.alert.core.rule;

import java.util.Objects;

/** A single {@code vital <op> threshold} comparison. */
public record ThresholdBound(VitalSign vital, Comparison comparison, double threshold) {

    public ThresholdBound {
        Objects.requireNonNull(vital, "vital");
        Objects.requireNonNull(comparison, "comparison");
    }

    public static ThresholdBound of(VitalSign vital, Comparison comparison, double threshold) {
        return new ThresholdBound(vital, comparison, threshold);
    }

    public boolean test(double value) {
        return comparison.test(value, threshold);
    }

    @Override
    public String toString() {
        return vital.wireKey() + " " + comparison.symbol() + " " + threshold;
    }
}
