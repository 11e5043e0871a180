package com.medimind.alert.core.store;

public enum AdmitOutcome {
    CREATED,
    /** Folded into the unacknowledged alert of the same dedup key; escalation progress kept. */
    MERGED,
    /** The dedup key already has an acknowledged alert; nothing re-triggers. */
    SUPPRESSED
}
