package com.medimind.alert.core.escalation;

@FunctionalInterface
public interface ScheduledTimer {
    /** Best effort; a task already running is not interrupted. */
    void cancel();
}
