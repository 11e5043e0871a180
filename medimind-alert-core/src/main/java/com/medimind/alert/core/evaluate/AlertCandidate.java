package com.medimind.alert.core.evaluate;

import com.medimind.alert.core.rule.AlertRule;
import java.util.Map;
import java.util.Objects;

/** Rule match produced by the evaluator, not yet admitted to the store. */
public record AlertCandidate(AlertRule rule, String userId, Map<String, Object> data) {

    public AlertCandidate {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(userId, "userId");
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public String ruleId() {
        return rule.id();
    }
}
