package com.medimind.alert.core.delivery;

import com.medimind.alert.core.escalation.EscalationStep;
import com.medimind.alert.core.model.Alert;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Routes each step to the {@link DeliveryChannel} registered for its method tag. */
@Component
@Slf4j
public class ChannelNotificationDispatcher implements NotificationDispatcher {

    private final Map<String, DeliveryChannel> channels;

    public ChannelNotificationDispatcher(List<DeliveryChannel> channels) {
        Map<String, DeliveryChannel> byMethod = new LinkedHashMap<>();
        if (channels != null) {
            for (DeliveryChannel channel : channels) {
                DeliveryChannel previous = byMethod.putIfAbsent(channel.method(), channel);
                if (previous != null) {
                    throw new IllegalStateException("Duplicate delivery channel for method " + channel.method() + ": "
                            + previous.getClass().getName() + " and "
                            + channel.getClass().getName());
                }
            }
        }
        this.channels = Collections.unmodifiableMap(byMethod);
    }

    @Override
    public DeliveryResult executeStep(Alert alert, EscalationStep step) {
        DeliveryChannel channel = channels.get(step.method());
        if (channel == null) {
            log.error(
                    "Escalation misconfigured: no delivery channel for method '{}' (alert={}, rule={})",
                    step.method(),
                    alert.id(),
                    alert.ruleId());
            return DeliveryResult.unknownMethod(step.method());
        }
        log.info("Executing escalation step: {} for alert {}", step.method(), alert.id());
        try {
            channel.deliver(alert, step);
            return DeliveryResult.delivered(step.method());
        } catch (DeliveryException ex) {
            return DeliveryResult.failed(step.method(), ex.getMessage());
        } catch (RuntimeException ex) {
            log.debug("Delivery channel {} threw unexpectedly", step.method(), ex);
            return DeliveryResult.failed(step.method(), ex.toString());
        }
    }

    public Set<String> methods() {
        return channels.keySet();
    }
}
