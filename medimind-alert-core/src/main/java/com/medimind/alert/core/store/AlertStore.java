package com.medimind.alert.core.store;

import com.medimind.alert.core.error.AlertAccessDeniedException;
import com.medimind.alert.core.error.AlertNotFoundException;
import com.medimind.alert.core.evaluate.AlertCandidate;
import com.medimind.alert.core.model.Alert;
import com.medimind.alert.core.model.AlertResolution;
import com.medimind.alert.core.model.AlertStatus;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * In-memory alert store keyed by alert id and by dedup key.
 *
 * <p>Mutations of one alert are serialized on its {@link AlertEntry} monitor. The dedup index is
 * only written inside {@link ConcurrentHashMap#compute}, which serializes admissions per key. A
 * thread holding a map bin may take an entry monitor; a thread holding an entry monitor never
 * touches the indices, so the two never wait on each other in reverse order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlertStore {
    private static final Comparator<Alert> BY_CREATION =
            Comparator.comparing(Alert::createdAt).thenComparing(Alert::id);

    private final Clock clock;
    private final AlertIdFactory idFactory;

    private final ConcurrentHashMap<String, AlertEntry> liveById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<DedupKey, AlertEntry> liveByKey = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Alert> resolved = new ConcurrentHashMap<>();

    public AdmitResult admit(AlertCandidate candidate) {
        Objects.requireNonNull(candidate, "candidate");
        DedupKey key = new DedupKey(candidate.userId(), candidate.ruleId());
        AdmitResult[] result = new AdmitResult[1];
        liveByKey.compute(key, (k, existing) -> {
            if (existing != null) {
                synchronized (existing) {
                    if (existing.isLive()) {
                        if (existing.status() == AlertStatus.ACKNOWLEDGED) {
                            result[0] = new AdmitResult(AdmitOutcome.SUPPRESSED, existing.snapshot());
                        } else {
                            existing.merge(candidate.data(), clock.instant());
                            result[0] = new AdmitResult(AdmitOutcome.MERGED, existing.snapshot());
                        }
                        return existing;
                    }
                }
            }
            AlertEntry created = new AlertEntry(
                    idFactory.next(), candidate.rule(), candidate.userId(), candidate.data(), clock.instant());
            liveById.put(created.id(), created);
            synchronized (created) {
                result[0] = new AdmitResult(AdmitOutcome.CREATED, created.snapshot());
            }
            return created;
        });
        return result[0];
    }

    /**
     * Marks the alert acknowledged and invalidates its escalation token.
     *
     * @return the current record; {@code changed} is false when it was already acknowledged
     * @throws AlertNotFoundException unknown, expired or resolved alert
     * @throws AlertAccessDeniedException {@code userId} does not own the alert
     */
    public StoreUpdate acknowledge(String alertId, String userId) {
        AlertEntry entry = liveById.get(alertId);
        if (entry == null) {
            throw new AlertNotFoundException(alertId);
        }
        synchronized (entry) {
            if (!entry.isLive()) {
                throw new AlertNotFoundException(alertId);
            }
            if (!entry.userId().equals(userId)) {
                throw new AlertAccessDeniedException(alertId, userId);
            }
            if (entry.status() == AlertStatus.ACKNOWLEDGED) {
                return new StoreUpdate(entry.snapshot(), false);
            }
            entry.acknowledge(clock.instant());
            return new StoreUpdate(entry.snapshot(), true);
        }
    }

    /**
     * Resolves the alert and moves it to the resolved archive. Resolving twice returns the
     * archived record unchanged.
     */
    public StoreUpdate resolve(String alertId, String resolvedBy, Map<String, Object> details) {
        AlertEntry entry = liveById.get(alertId);
        if (entry == null) {
            Alert archived = resolved.get(alertId);
            if (archived != null) {
                return new StoreUpdate(archived, false);
            }
            throw new AlertNotFoundException(alertId);
        }
        Alert snapshot;
        synchronized (entry) {
            if (entry.status() == AlertStatus.RESOLVED) {
                return new StoreUpdate(entry.snapshot(), false);
            }
            if (entry.isEvicted()) {
                throw new AlertNotFoundException(alertId);
            }
            entry.resolve(new AlertResolution(clock.instant(), resolvedBy, details));
            snapshot = entry.snapshot();
            resolved.put(alertId, snapshot);
        }
        unindex(entry);
        return new StoreUpdate(snapshot, true);
    }

    /**
     * Arms escalation once per alert.
     *
     * @return the generation token timers must present when they fire, or empty when the alert is
     *     no longer active or was armed before
     */
    public OptionalLong armEscalation(String alertId) {
        AlertEntry entry = liveById.get(alertId);
        if (entry == null) {
            return OptionalLong.empty();
        }
        synchronized (entry) {
            if (entry.isArmed() || !entry.acceptsStep(entry.generation())) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(entry.arm());
        }
    }

    /** Whether timers holding {@code generation} may still fire for the alert. */
    public boolean isEscalationCurrent(String alertId, long generation) {
        AlertEntry entry = liveById.get(alertId);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            return entry.acceptsStep(generation);
        }
    }

    /**
     * Records that escalation step {@code stepIndex} fired, provided {@code generation} is still
     * current and the alert is active. This check is the point after which a step may deliver.
     */
    public Optional<Alert> recordEscalationStep(String alertId, int stepIndex, long generation) {
        AlertEntry entry = liveById.get(alertId);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            if (!entry.acceptsStep(generation)) {
                return Optional.empty();
            }
            entry.advanceTo(stepIndex, clock.instant());
            return Optional.of(entry.snapshot());
        }
    }

    /** Live or archived record. Expired alerts are gone. */
    public Optional<Alert> find(String alertId) {
        AlertEntry entry = liveById.get(alertId);
        if (entry != null) {
            synchronized (entry) {
                if (!entry.isEvicted()) {
                    return Optional.of(entry.snapshot());
                }
            }
        }
        return Optional.ofNullable(resolved.get(alertId));
    }

    /** Active alerts, oldest first; a null {@code userId} returns every user's alerts. */
    public List<Alert> active(String userId) {
        return live(userId, alert -> alert.status() == AlertStatus.ACTIVE);
    }

    public List<Alert> acknowledged(String userId) {
        return live(userId, alert -> alert.status() == AlertStatus.ACKNOWLEDGED);
    }

    /**
     * Removes live alerts and archived resolutions created strictly before {@code cutoff}. An
     * evicted entry leaves the dedup index only if it is still the indexed one, so a newer alert
     * admitted for the same key is never dropped.
     */
    public ExpiryReport expire(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff");
        int active = 0;
        int acknowledged = 0;
        List<String> removed = new ArrayList<>();
        for (AlertEntry entry : liveById.values()) {
            AlertStatus status;
            synchronized (entry) {
                if (!entry.isLive() || !entry.createdAt().isBefore(cutoff)) {
                    continue;
                }
                status = entry.status();
                entry.evict();
            }
            unindex(entry);
            removed.add(entry.id());
            if (status == AlertStatus.ACKNOWLEDGED) {
                acknowledged++;
            } else {
                active++;
            }
        }
        int archived = 0;
        for (Map.Entry<String, Alert> e : resolved.entrySet()) {
            if (e.getValue().createdAt().isBefore(cutoff) && resolved.remove(e.getKey(), e.getValue())) {
                removed.add(e.getKey());
                archived++;
            }
        }
        if (!removed.isEmpty()) {
            log.info(
                    "Expired {} alerts created before {} (active={}, acknowledged={}, resolved={})",
                    removed.size(),
                    cutoff,
                    active,
                    acknowledged,
                    archived);
        }
        return new ExpiryReport(cutoff, active, acknowledged, archived, removed);
    }

    private void unindex(AlertEntry entry) {
        liveById.remove(entry.id(), entry);
        liveByKey.remove(entry.key(), entry);
    }

    private List<Alert> live(String userId, Predicate<Alert> filter) {
        List<Alert> out = new ArrayList<>();
        for (AlertEntry entry : liveById.values()) {
            if (userId != null && !userId.equals(entry.userId())) {
                continue;
            }
            Alert alert;
            synchronized (entry) {
                if (entry.isEvicted()) {
                    continue;
                }
                alert = entry.snapshot();
            }
            if (filter.test(alert)) {
                out.add(alert);
            }
        }
        out.sort(BY_CREATION);
        return out;
    }
}
