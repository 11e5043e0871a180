package com.medimind.notification.sink.logging;

import com.medimind.alert.core.delivery.DeliveryChannel;
import com.medimind.alert.core.delivery.DeliveryMethod;
import com.medimind.alert.core.escalation.EscalationStep;
import com.medimind.alert.core.model.Alert;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes the notification to the log instead of calling a provider. */
public final class LoggingDeliveryChannel implements DeliveryChannel {
    private static final Logger log = LoggerFactory.getLogger(LoggingDeliveryChannel.class);

    private final String method;

    public LoggingDeliveryChannel(String method) {
        this.method = Objects.requireNonNull(method, "method");
    }

    @Override
    public String method() {
        return method;
    }

    @Override
    public void deliver(Alert alert, EscalationStep step) {
        if (alert == null) return;
        if (isUrgent()) {
            log.warn(
                    "notify method={}, alert={}, user={}, severity={}, message={}, step={}",
                    method,
                    alert.id(),
                    alert.userId(),
                    alert.severity().wireValue(),
                    alert.message(),
                    step.message());
        } else {
            log.info(
                    "notify method={}, alert={}, user={}, severity={}, message={}, step={}",
                    method,
                    alert.id(),
                    alert.userId(),
                    alert.severity().wireValue(),
                    alert.message(),
                    step.message());
        }
    }

    private boolean isUrgent() {
        return DeliveryMethod.PHONE_CALL.equals(method) || DeliveryMethod.EMERGENCY_SERVICES.equals(method);
    }
}
