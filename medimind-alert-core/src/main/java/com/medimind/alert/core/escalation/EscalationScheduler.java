package com.medimind.alert.core.escalation;

import com.medimind.alert.core.delivery.DeliveryResult;
import com.medimind.alert.core.delivery.NotificationDispatcher;
import com.medimind.alert.core.event.AlertEvent;
import com.medimind.alert.core.event.AlertEventBus;
import com.medimind.alert.core.event.AlertEventType;
import com.medimind.alert.core.model.Alert;
import com.medimind.alert.core.store.AlertStore;
import com.medimind.alert.core.telemetry.AlertTelemetry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs escalation paths. Each step gets its own timer at {@code createdAt + delay}; a firing
 * timer presents the generation token captured when the path was armed and only delivers if the
 * store still accepts it. Deliveries run on the delivery executor so a slow channel never holds a
 * timer thread.
 */
@Component
@Slf4j
public class EscalationScheduler {
    public static final String DELIVERY_EXECUTOR = "alertDeliveryExecutor";

    private final AlertStore store;
    private final EscalationPathCatalog paths;
    private final EscalationTimer timer;
    private final NotificationDispatcher dispatcher;
    private final Executor deliveryExecutor;
    private final AlertEventBus events;
    private final AlertTelemetry telemetry;
    private final Clock clock;
    private final ConcurrentHashMap<String, Handle> handles = new ConcurrentHashMap<>();

    public EscalationScheduler(
            AlertStore store,
            EscalationPathCatalog paths,
            EscalationTimer timer,
            NotificationDispatcher dispatcher,
            @Qualifier(DELIVERY_EXECUTOR) Executor deliveryExecutor,
            AlertEventBus events,
            AlertTelemetry telemetry,
            Clock clock) {
        this.store = store;
        this.paths = paths;
        this.timer = timer;
        this.dispatcher = dispatcher;
        this.deliveryExecutor = deliveryExecutor;
        this.events = events;
        this.telemetry = telemetry;
        this.clock = clock;
    }

    /**
     * Arms the escalation path of the alert's severity. Calling it again for an alert that was
     * already armed, merged or not, leaves the running path untouched.
     */
    public EscalationState start(Alert alert) {
        if (!alert.requiresAcknowledgment()) {
            return EscalationState.IDLE;
        }
        EscalationPath path = paths.path(alert.severity());
        if (path.isEmpty()) {
            log.warn("No escalation path configured for severity {} (alert={})", alert.severity(), alert.id());
            return EscalationState.IDLE;
        }
        OptionalLong token = store.armEscalation(alert.id());
        if (token.isEmpty()) {
            return state(alert.id()).orElse(EscalationState.IDLE);
        }
        long generation = token.getAsLong();
        Handle handle = new Handle(generation, path.size());
        handles.put(alert.id(), handle);
        for (int i = 0; i < path.size(); i++) {
            int index = i;
            EscalationStep step = path.step(i);
            Instant fireAt = alert.createdAt().plus(step.delay());
            handle.add(timer.schedule(fireAt, () -> fire(alert.id(), handle, index, step)));
        }
        // an acknowledge that landed between arming and registering the handle found nothing to cancel
        if (!store.isEscalationCurrent(alert.id(), generation)) {
            handle.cancel();
        }
        log.info(
                "Escalation scheduled for alert {}: {} steps, severity {}",
                alert.id(),
                path.size(),
                alert.severity().wireValue());
        return handle.state();
    }

    /** Cancels every pending timer of the alert. Steps that already fired are not rolled back. */
    public void cancel(String alertId) {
        Handle handle = handles.get(alertId);
        if (handle != null && handle.cancel()) {
            log.info("Escalation cancelled for alert {}", alertId);
        }
    }

    /** Cancels and forgets the alert's handle. */
    public void release(String alertId) {
        Handle handle = handles.remove(alertId);
        if (handle != null) {
            handle.cancel();
        }
    }

    public Optional<EscalationState> state(String alertId) {
        Handle handle = handles.get(alertId);
        return handle == null ? Optional.empty() : Optional.of(handle.state());
    }

    private void fire(String alertId, Handle handle, int index, EscalationStep step) {
        Optional<Alert> current = store.recordEscalationStep(alertId, index, handle.generation);
        if (current.isEmpty()) {
            telemetry.recordStaleFire();
            log.debug("Skipping stale escalation step {} ({}) for alert {}", index, step.method(), alertId);
            return;
        }
        handle.stepFired();
        telemetry.recordStepFired(step.method());
        Alert alert = current.get();
        try {
            deliveryExecutor.execute(() -> deliver(alert, step, handle.generation));
        } catch (RejectedExecutionException ex) {
            telemetry.recordDeliveryFailure(step.method());
            log.warn("Delivery executor rejected step {} for alert {}", step.method(), alertId, ex);
        }
    }

    private void deliver(Alert alert, EscalationStep step, long generation) {
        // the delivery may have queued behind others; an acknowledge that returned meanwhile wins
        if (!store.isEscalationCurrent(alert.id(), generation)) {
            telemetry.recordStaleFire();
            log.debug("Dropping queued escalation step {} for alert {}", step.method(), alert.id());
            return;
        }
        DeliveryResult result;
        try {
            result = dispatcher.executeStep(alert, step);
        } catch (RuntimeException ex) {
            result = DeliveryResult.failed(step.method(), ex.toString());
        }
        switch (result.status()) {
            case FAILED -> {
                telemetry.recordDeliveryFailure(step.method());
                log.warn(
                        "Escalation step {} failed for alert {}: {}. Remaining steps stay scheduled",
                        step.method(),
                        alert.id(),
                        result.reason());
            }
            case UNKNOWN_METHOD -> telemetry.recordUnknownMethod(step.method());
            default -> {}
        }
        events.publish(new AlertEvent(AlertEventType.ALERT_UPDATED, alert, clock.instant()));
    }

    private static final class Handle {
        private final long generation;
        private final int stepCount;
        private final List<ScheduledTimer> timers = new ArrayList<>();
        private EscalationState state = EscalationState.SCHEDULED;
        private int fired;

        Handle(long generation, int stepCount) {
            this.generation = generation;
            this.stepCount = stepCount;
        }

        synchronized void add(ScheduledTimer scheduled) {
            if (state == EscalationState.CANCELLED) {
                scheduled.cancel();
            } else {
                timers.add(scheduled);
            }
        }

        synchronized void stepFired() {
            if (state == EscalationState.CANCELLED) {
                return;
            }
            fired++;
            state = fired >= stepCount ? EscalationState.EXHAUSTED : EscalationState.EXECUTING;
        }

        synchronized boolean cancel() {
            timers.forEach(ScheduledTimer::cancel);
            timers.clear();
            if (state.isTerminal()) {
                return false;
            }
            state = EscalationState.CANCELLED;
            return true;
        }

        synchronized EscalationState state() {
            return state;
        }
    }
}
