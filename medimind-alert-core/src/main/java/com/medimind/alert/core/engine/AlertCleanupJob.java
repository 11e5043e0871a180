package com.medimind.alert.core.engine;

import com.medimind.alert.core.config.AlertingProperties;
import com.medimind.alert.core.store.ExpiryReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class AlertCleanupJob {
    private final AlertEngine engine;
    private final AlertingProperties properties;

    @Scheduled(
            fixedRateString = "${medimind.alerts.cleanup.rate-millis:3600000}",
            initialDelayString = "${medimind.alerts.cleanup.rate-millis:3600000}")
    public void sweep() {
        if (!properties.getCleanup().isEnabled()) {
            return;
        }
        ExpiryReport report = engine.cleanupExpiredAlerts(properties.getRetentionHours());
        log.debug("Alert cleanup removed {} records", report.total());
    }
}
