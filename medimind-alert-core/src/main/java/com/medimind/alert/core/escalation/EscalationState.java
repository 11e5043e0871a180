package com.medimind.alert.core.escalation;

public enum EscalationState {
    /** The alert's rule does not require acknowledgment. */
    IDLE,
    SCHEDULED,
    EXECUTING,
    CANCELLED,
    /** Every step fired; the alert stays active until a human acts. */
    EXHAUSTED;

    public boolean isTerminal() {
        return this == IDLE || this == CANCELLED || this == EXHAUSTED;
    }
}
