package com.medimind.alert.core.engine;

import com.medimind.alert.core.error.AlertNotFoundException;
import com.medimind.alert.core.escalation.EscalationScheduler;
import com.medimind.alert.core.escalation.EscalationState;
import com.medimind.alert.core.evaluate.AlertCandidate;
import com.medimind.alert.core.evaluate.AlertEvaluator;
import com.medimind.alert.core.event.AlertEvent;
import com.medimind.alert.core.event.AlertEventBus;
import com.medimind.alert.core.event.AlertEventListener;
import com.medimind.alert.core.event.AlertEventType;
import com.medimind.alert.core.event.Subscription;
import com.medimind.alert.core.model.Alert;
import com.medimind.alert.core.model.VitalsSnapshot;
import com.medimind.alert.core.rule.Severity;
import com.medimind.alert.core.store.AdmitResult;
import com.medimind.alert.core.store.AlertStore;
import com.medimind.alert.core.store.ExpiryReport;
import com.medimind.alert.core.store.StoreUpdate;
import com.medimind.alert.core.telemetry.AlertTelemetry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of the alerting engine: evaluation, admission, escalation and the operator
 * lifecycle calls. Events are handed to the bus and never processed on the caller's thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertEngine {
    private final AlertEvaluator evaluator;
    private final AlertStore store;
    private final EscalationScheduler scheduler;
    private final AlertEventBus events;
    private final AlertTelemetry telemetry;
    private final Clock clock;

    /**
     * Evaluates the snapshot and admits every matching rule.
     *
     * @param userId owner of the readings; overrides the snapshot's own {@code userId} when set
     * @return created and merged alerts in rule order; suppressed ones are left out
     */
    public List<Alert> checkVitalSigns(VitalsSnapshot snapshot, String userId) {
        String owner = userId != null ? userId : snapshot == null ? null : snapshot.userId();
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        List<AlertCandidate> candidates = evaluator.evaluate(snapshot, owner);
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<Alert> raised = new ArrayList<>(candidates.size());
        for (AlertCandidate candidate : candidates) {
            AdmitResult result = store.admit(candidate);
            telemetry.recordAdmission(result.outcome(), candidate.rule().severity());
            if (result.isSuppressed()) {
                log.debug("Alert {} already acknowledged, not re-triggering", result.alert().id());
                continue;
            }
            Alert alert = result.alert();
            logTriggered(alert);
            scheduler.start(alert);
            events.publish(new AlertEvent(AlertEventType.ALERT, alert, clock.instant()));
            raised.add(alert);
        }
        return raised;
    }

    /**
     * Acknowledges the alert and cancels its pending escalation before returning. Acknowledging
     * twice returns the current record without a second event.
     */
    public Alert acknowledgeAlert(String alertId, String userId) {
        StoreUpdate update = store.acknowledge(alertId, userId);
        scheduler.cancel(alertId);
        if (update.changed()) {
            log.info("Alert {} acknowledged by user {}", alertId, userId);
            events.publish(new AlertEvent(AlertEventType.ALERT_ACKNOWLEDGED, update.alert(), clock.instant()));
        }
        return update.alert();
    }

    /** Resolves the alert. Idempotent: resolving again returns the first resolution unchanged. */
    public Alert resolveAlert(String alertId, String userId, Map<String, Object> resolution) {
        if (store.find(alertId).isEmpty()) {
            throw new AlertNotFoundException(alertId);
        }
        scheduler.cancel(alertId);
        StoreUpdate update = store.resolve(alertId, userId, resolution);
        if (update.changed()) {
            log.info("Alert {} resolved by {}", alertId, userId);
            events.publish(new AlertEvent(AlertEventType.ALERT_RESOLVED, update.alert(), clock.instant()));
        }
        return update.alert();
    }

    public List<Alert> getActiveAlerts(String userId) {
        return store.active(userId);
    }

    public List<Alert> getAcknowledgedAlerts(String userId) {
        return store.acknowledged(userId);
    }

    public Optional<Alert> getAlert(String alertId) {
        return store.find(alertId);
    }

    public EscalationState getEscalationState(String alertId) {
        if (store.find(alertId).isEmpty()) {
            throw new AlertNotFoundException(alertId);
        }
        return scheduler.state(alertId).orElse(EscalationState.IDLE);
    }

    /** Drops alerts created more than {@code hours} ago, live ones and archived resolutions alike. */
    public ExpiryReport cleanupExpiredAlerts(long hours) {
        if (hours < 0) {
            throw new IllegalArgumentException("hours must not be negative: " + hours);
        }
        ExpiryReport report = store.expire(clock.instant().minus(Duration.ofHours(hours)));
        report.removedAlertIds().forEach(scheduler::release);
        telemetry.recordExpired(report.total());
        return report;
    }

    public Subscription subscribe(AlertEventListener listener, AlertEventType... types) {
        return events.subscribe(listener, types);
    }

    private void logTriggered(Alert alert) {
        if (alert.severity() == Severity.CRITICAL) {
            log.error(
                    "ALERT TRIGGERED: {} (alert={}, user={}) {}",
                    alert.message(),
                    alert.id(),
                    alert.userId(),
                    alert.data());
        } else {
            log.warn(
                    "ALERT TRIGGERED: {} (alert={}, user={}) {}",
                    alert.message(),
                    alert.id(),
                    alert.userId(),
                    alert.data());
        }
    }
}
