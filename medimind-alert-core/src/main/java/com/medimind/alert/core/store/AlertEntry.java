package com.medimind.alert.core.store;

import com.medimind.alert.core.model.Alert;
import com.medimind.alert.core.model.AlertResolution;
import com.medimind.alert.core.model.AlertStatus;
import com.medimind.alert.core.rule.AlertRule;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable state of one live alert. Every read and write happens while holding the entry's
 * monitor; callers leave the monitor before touching the store's indices.
 */
final class AlertEntry {
    private final String id;
    private final AlertRule rule;
    private final String userId;
    private final Instant createdAt;
    private final Map<String, Object> data;

    private Instant updatedAt;
    private AlertStatus status = AlertStatus.ACTIVE;
    private Instant acknowledgedAt;
    private int escalationLevel = Alert.NO_ESCALATION;
    private long generation = 1L;
    private boolean armed;
    private boolean evicted;
    private AlertResolution resolution;

    AlertEntry(String id, AlertRule rule, String userId, Map<String, Object> data, Instant createdAt) {
        this.id = id;
        this.rule = rule;
        this.userId = userId;
        this.data = new LinkedHashMap<>(data);
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    String id() {
        return id;
    }

    String userId() {
        return userId;
    }

    Instant createdAt() {
        return createdAt;
    }

    DedupKey key() {
        return new DedupKey(userId, rule.id());
    }

    AlertStatus status() {
        return status;
    }

    boolean isEvicted() {
        return evicted;
    }

    /** Active or acknowledged and still indexed. */
    boolean isLive() {
        return !evicted && status.isLive();
    }

    boolean isArmed() {
        return armed;
    }

    long generation() {
        return generation;
    }

    void merge(Map<String, Object> fresh, Instant now) {
        data.putAll(fresh);
        updatedAt = now;
    }

    long arm() {
        armed = true;
        return generation;
    }

    boolean acceptsStep(long token) {
        return !evicted && status == AlertStatus.ACTIVE && token == generation;
    }

    void advanceTo(int stepIndex, Instant now) {
        escalationLevel = Math.max(escalationLevel, stepIndex);
        updatedAt = now;
    }

    void acknowledge(Instant now) {
        status = AlertStatus.ACKNOWLEDGED;
        acknowledgedAt = now;
        updatedAt = now;
        generation++;
    }

    void resolve(AlertResolution resolution) {
        this.status = AlertStatus.RESOLVED;
        this.resolution = resolution;
        this.updatedAt = resolution.resolvedAt();
        generation++;
    }

    void evict() {
        evicted = true;
        generation++;
    }

    Alert snapshot() {
        return new Alert(
                id,
                rule.id(),
                userId,
                rule.severity(),
                rule.message(),
                data,
                createdAt,
                updatedAt,
                status,
                acknowledgedAt != null,
                acknowledgedAt,
                rule.requiresAcknowledgment(),
                escalationLevel,
                resolution);
    }
}
