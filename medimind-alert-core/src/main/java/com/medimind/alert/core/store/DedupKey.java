package com.medimind.alert.core.store;

import java.util.Objects;

/** (userId, ruleId): at most one active or acknowledged alert exists per key. */
public record DedupKey(String userId, String ruleId) {

    public DedupKey {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(ruleId, "ruleId");
    }
}
