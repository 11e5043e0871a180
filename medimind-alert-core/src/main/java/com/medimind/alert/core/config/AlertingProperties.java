package com.medimind.alert.core.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "medimind.alerts")
public class AlertingProperties {
    private long retentionHours = 72;
    private boolean loggingEnabled = true;
    private Cleanup cleanup = new Cleanup();
    private Scheduler scheduler = new Scheduler();
    private Delivery delivery = new Delivery();
    private Escalation escalation = new Escalation();

    public long getRetentionHours() {
        return retentionHours;
    }

    public void setRetentionHours(long retentionHours) {
        this.retentionHours = retentionHours;
    }

    public boolean isLoggingEnabled() {
        return loggingEnabled;
    }

    public void setLoggingEnabled(boolean loggingEnabled) {
        this.loggingEnabled = loggingEnabled;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    public void setCleanup(Cleanup cleanup) {
        this.cleanup = cleanup;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public void setDelivery(Delivery delivery) {
        this.delivery = delivery;
    }

    public Escalation getEscalation() {
        return escalation;
    }

    public void setEscalation(Escalation escalation) {
        this.escalation = escalation;
    }

    public static class Cleanup {
        private boolean enabled = true;
        private long rateMillis = 3_600_000L;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getRateMillis() {
            return rateMillis;
        }

        public void setRateMillis(long rateMillis) {
            this.rateMillis = rateMillis;
        }
    }

    public static class Scheduler {
        private int threads = 2;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }

    public static class Delivery {
        private int threads = 8;

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }

    public static class Escalation {
        /** Severity wire value ({@code critical}, {@code warning}, {@code info}) to replacement steps. */
        private Map<String, List<Step>> paths = new LinkedHashMap<>();

        public Map<String, List<Step>> getPaths() {
            return paths;
        }

        public void setPaths(Map<String, List<Step>> paths) {
            this.paths = paths;
        }
    }

    public static class Step {
        private String method;
        private Duration delay = Duration.ZERO;
        private String message;

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public Duration getDelay() {
            return delay;
        }

        public void setDelay(Duration delay) {
            this.delay = delay;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }
    }
}
