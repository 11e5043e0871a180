package com.medimind.alert.core.escalation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** {@link EscalationTimer} backed by a {@link ScheduledExecutorService}. Delays are computed from the clock. */
public final class ExecutorEscalationTimer implements EscalationTimer, AutoCloseable {

    private final ScheduledExecutorService executor;
    private final Clock clock;

    public ExecutorEscalationTimer(int threads, Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        AtomicInteger counter = new AtomicInteger();
        ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "medimind-escalation-timer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        pool.setRemoveOnCancelPolicy(true);
        this.executor = pool;
    }

    @Override
    public ScheduledTimer schedule(Instant fireAt, Runnable task) {
        long delayMillis = Math.max(0L, Duration.between(clock.instant(), fireAt).toMillis());
        ScheduledFuture<?> future = executor.schedule(task, delayMillis, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
