package com.medimind.notification.sink.logging;

import static org.assertj.core.api.Assertions.assertThat;

import com.medimind.alert.core.delivery.DeliveryMethod;
import com.medimind.alert.core.escalation.EscalationStep;
import com.medimind.alert.core.event.AlertEvent;
import com.medimind.alert.core.event.AlertEventType;
import com.medimind.alert.core.model.Alert;
import com.medimind.alert.core.model.AlertStatus;
import com.medimind.alert.core.rule.Severity;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

@ExtendWith(OutputCaptureExtension.class)
class LoggingDeliveryChannelTest {
    private static final Instant NOW = Instant.parse("2025-01-01T08:00:00Z");

    @Test
    void deliveryIsWrittenToTheLog(CapturedOutput output) {
        LoggingDeliveryChannel channel = new LoggingDeliveryChannel(DeliveryMethod.PHONE_CALL);

        channel.deliver(alert(), EscalationStep.of(DeliveryMethod.PHONE_CALL, Duration.ofSeconds(60), "Emergency call"));

        assertThat(channel.method()).isEqualTo(DeliveryMethod.PHONE_CALL);
        assertThat(output).contains("notify method=phone_call").contains("alert=alert_1_x").contains("Emergency call");
    }

    @Test
    void eventsAreWrittenToTheLog(CapturedOutput output) {
        new LoggingAlertEventListener().onEvent(new AlertEvent(AlertEventType.ALERT_ACKNOWLEDGED, alert(), NOW));

        assertThat(output).contains("alert event type=alertAcknowledged").contains("rule=heart_rate_critical");
    }

    private static Alert alert() {
        return new Alert(
                "alert_1_x",
                "heart_rate_critical",
                "u1",
                Severity.CRITICAL,
                "Critical heart rate detected",
                Map.of("value", 35),
                NOW,
                NOW,
                AlertStatus.ACTIVE,
                false,
                null,
                true,
                Alert.NO_ESCALATION,
                null);
    }
}
