package com.medimind.alert.core.event;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publish/subscribe bus for alert lifecycle events. Every subscriber owns a dedicated worker
 * thread and deque, so {@link #publish} never blocks on subscriber processing and a slow or
 * failing subscriber cannot delay the others.
 */
public final class AlertEventBus implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AlertEventBus.class);

    private final CopyOnWriteArrayList<Worker> workers = new CopyOnWriteArrayList<>();
    private final AtomicInteger sequence = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    public Subscription subscribe(AlertEventListener listener, AlertEventType... types) {
        Objects.requireNonNull(listener, "listener");
        if (closed.get()) {
            throw new IllegalStateException("Alert event bus is closed");
        }
        Set<AlertEventType> kinds = types == null || types.length == 0
                ? EnumSet.allOf(AlertEventType.class)
                : EnumSet.copyOf(Arrays.asList(types));
        Worker worker = new Worker(listener, kinds, sequence.incrementAndGet());
        workers.add(worker);
        return worker;
    }

    public void publish(AlertEvent event) {
        if (event == null) return;
        for (Worker worker : workers) {
            if (worker.accepts(event.type())) {
                worker.offer(event);
            }
        }
    }

    public int subscriberCount() {
        return workers.size();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            workers.forEach(Worker::shutdown);
            workers.clear();
        }
    }

    private final class Worker implements Runnable, Subscription {
        private final AlertEventListener listener;
        private final Set<AlertEventType> kinds;
        private final LinkedBlockingDeque<AlertEvent> queue = new LinkedBlockingDeque<>();
        private final AtomicBoolean running = new AtomicBoolean(true);
        private final Thread thread;

        Worker(AlertEventListener listener, Set<AlertEventType> kinds, int id) {
            this.listener = listener;
            this.kinds = kinds;
            this.thread = new Thread(this, "medimind-alert-events-" + id);
            this.thread.setDaemon(true);
            this.thread.start();
        }

        boolean accepts(AlertEventType type) {
            return running.get() && kinds.contains(type);
        }

        void offer(AlertEvent event) {
            queue.offer(event);
        }

        void shutdown() {
            running.set(false);
            thread.interrupt();
        }

        @Override
        public void close() {
            workers.remove(this);
            shutdown();
        }

        @Override
        public boolean isActive() {
            return running.get();
        }

        @Override
        public void run() {
            while (running.get()) {
                AlertEvent event = null;
                try {
                    event = queue.poll(250, TimeUnit.MILLISECONDS);
                    if (event != null) listener.onEvent(event);
                } catch (InterruptedException ie) {
                    // shutdown
                    Thread.currentThread().interrupt();
                    return;
                } catch (Throwable t) {
                    log.warn(
                            "Alert listener {} failed to handle {} for alert {} due to {}",
                            listener.getClass().getName(),
                            event == null ? "<none>" : event.type().wireName(),
                            event == null ? "<none>" : event.alert().id(),
                            t.getMessage(),
                            t);
                }
            }
        }
    }
}
