package com.medimind.alert.core.delivery;

import com.medimind.alert.core.escalation.EscalationStep;
import com.medimind.alert.core.model.Alert;

/** Delivers escalation steps for one method tag, e.g. {@code sms}. */
public interface DeliveryChannel {

    String method();

    void deliver(Alert alert, EscalationStep step) throws DeliveryException;
}
