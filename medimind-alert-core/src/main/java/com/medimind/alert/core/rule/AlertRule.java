package com.medimind.alert.core.rule;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable threshold rule.
 *
 * @param id stable rule identifier, half of the dedup key
 * @param group vital group the rule competes in; the first matching rule of a group wins
 * @param condition threshold table evaluated against the snapshot
 * @param severity severity of alerts raised by the rule, also selects the escalation path
 * @param message human readable message copied onto the alert
 * @param thresholdDescription threshold text copied into the alert payload
 * @param requiresAcknowledgment whether alerts of this rule run an escalation protocol
 * @param escalationDelay base escalation delay advertised by the rule
 */
public record AlertRule(
        String id,
        String group,
        RuleCondition condition,
        Severity severity,
        String message,
        String thresholdDescription,
        boolean requiresAcknowledgment,
        Duration escalationDelay) {

    public AlertRule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("rule id must not be blank");
        }
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("rule group must not be blank: " + id);
        }
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(severity, "severity");
        escalationDelay = escalationDelay == null ? Duration.ZERO : escalationDelay;
    }

    public Set<VitalSign> vitals() {
        return condition.vitals();
    }
}
