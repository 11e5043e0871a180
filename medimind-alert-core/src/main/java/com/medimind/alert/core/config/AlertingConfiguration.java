package com.medimind.alert.core.config;

import com.medimind.alert.core.escalation.EscalationPathCatalog;
import com.medimind.alert.core.escalation.EscalationScheduler;
import com.medimind.alert.core.escalation.EscalationStep;
import com.medimind.alert.core.escalation.ExecutorEscalationTimer;
import com.medimind.alert.core.event.AlertEventBus;
import com.medimind.alert.core.rule.RuleCatalog;
import com.medimind.alert.core.rule.Severity;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class AlertingConfiguration {

    @Bean
    public RuleCatalog ruleCatalog() {
        return RuleCatalog.defaults();
    }

    @Bean
    public EscalationPathCatalog escalationPathCatalog(AlertingProperties properties) {
        Map<Severity, List<EscalationStep>> overrides = new EnumMap<>(Severity.class);
        properties.getEscalation().getPaths().forEach((severity, steps) -> {
            List<EscalationStep> converted = new ArrayList<>();
            for (AlertingProperties.Step step : steps) {
                converted.add(EscalationStep.of(step.getMethod(), step.getDelay(), step.getMessage()));
            }
            overrides.put(Severity.fromWireValue(severity), converted);
            log.info("Escalation path for {} overridden with {} steps", severity, converted.size());
        });
        return EscalationPathCatalog.defaults().withOverrides(overrides);
    }

    @Bean(destroyMethod = "close")
    public ExecutorEscalationTimer escalationTimer(AlertingProperties properties, Clock clock) {
        return new ExecutorEscalationTimer(properties.getScheduler().getThreads(), clock);
    }

    @Bean(name = EscalationScheduler.DELIVERY_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService alertDeliveryExecutor(AlertingProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getDelivery().getThreads()), r -> {
            Thread t = new Thread(r, "medimind-alert-delivery-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "close")
    public AlertEventBus alertEventBus() {
        return new AlertEventBus();
    }
}
