package com.medimind.alert.core.escalation;

import java.time.Instant;

/** Arms one-shot tasks at absolute instants. */
public interface EscalationTimer {
    ScheduledTimer schedule(Instant fireAt, Runnable task);
}
