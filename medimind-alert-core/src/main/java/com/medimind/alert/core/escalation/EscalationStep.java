package com.medimind.alert.core.escalation;

import java.time.Duration;

/**
 * One step of an escalation path.
 *
 * @param method delivery method tag, routed by the notification dispatcher
 * @param delay offset from alert creation; steps fire at {@code createdAt + delay}
 * @param message message template handed to the delivery channel
 */
public record EscalationStep(String method, Duration delay, String message) {

    public EscalationStep {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("escalation step method must not be blank");
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("escalation step delay must be >= 0: " + method);
        }
        method = method.trim();
    }

    public static EscalationStep of(String method, Duration delay, String message) {
        return new EscalationStep(method, delay, message);
    }
}
