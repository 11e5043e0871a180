package com.medimind.notification.sink.logging;

import com.medimind.alert.core.event.AlertEvent;
import com.medimind.alert.core.event.AlertEventListener;
import com.medimind.alert.core.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingAlertEventListener implements AlertEventListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingAlertEventListener.class);

    @Override
    public void onEvent(AlertEvent event) {
        if (event == null) return;
        Alert alert = event.alert();
        log.info(
                "alert event type={}, ts={}, id={}, rule={}, user={}, status={}, level={}",
                event.type().wireName(),
                event.emittedAt(),
                alert.id(),
                alert.ruleId(),
                alert.userId(),
                alert.status().wireValue(),
                alert.escalationLevel());
    }
}
