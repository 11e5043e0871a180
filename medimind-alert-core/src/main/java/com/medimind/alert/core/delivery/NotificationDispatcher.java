package com.medimind.alert.core.delivery;

import com.medimind.alert.core.escalation.EscalationStep;
import com.medimind.alert.core.model.Alert;

/**
 * Delivery contract invoked once per fired escalation step. The result is advisory; escalation
 * never waits on or reacts to it beyond logging.
 */
@FunctionalInterface
public interface NotificationDispatcher {
    DeliveryResult executeStep(Alert alert, EscalationStep step);
}
