package com.medimind.notification.sink.logging.autoconfigure;

import com.medimind.alert.core.delivery.DeliveryChannel;
import com.medimind.alert.core.delivery.DeliveryMethod;
import com.medimind.alert.core.event.AlertEventBus;
import com.medimind.alert.core.event.Subscription;
import com.medimind.notification.sink.logging.LoggingAlertEventListener;
import com.medimind.notification.sink.logging.LoggingDeliveryChannel;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/** Logging channel for every known delivery method, plus an event subscriber that logs the lifecycle. */
@AutoConfiguration
public class LoggingNotificationAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "pushNotificationChannel")
    public DeliveryChannel pushNotificationChannel() {
        return new LoggingDeliveryChannel(DeliveryMethod.PUSH_NOTIFICATION);
    }

    @Bean
    @ConditionalOnMissingBean(name = "smsChannel")
    public DeliveryChannel smsChannel() {
        return new LoggingDeliveryChannel(DeliveryMethod.SMS);
    }

    @Bean
    @ConditionalOnMissingBean(name = "emailChannel")
    public DeliveryChannel emailChannel() {
        return new LoggingDeliveryChannel(DeliveryMethod.EMAIL);
    }

    @Bean
    @ConditionalOnMissingBean(name = "phoneCallChannel")
    public DeliveryChannel phoneCallChannel() {
        return new LoggingDeliveryChannel(DeliveryMethod.PHONE_CALL);
    }

    @Bean
    @ConditionalOnMissingBean(name = "emergencyServicesChannel")
    public DeliveryChannel emergencyServicesChannel() {
        return new LoggingDeliveryChannel(DeliveryMethod.EMERGENCY_SERVICES);
    }

    @Bean
    @ConditionalOnMissingBean(name = "inAppNotificationChannel")
    public DeliveryChannel inAppNotificationChannel() {
        return new LoggingDeliveryChannel(DeliveryMethod.IN_APP_NOTIFICATION);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnBean(AlertEventBus.class)
    @ConditionalOnProperty(
            prefix = "medimind.alerts",
            name = "logging-enabled",
            havingValue = "true",
            matchIfMissing = true)
    public Subscription loggingAlertSubscription(AlertEventBus bus) {
        return bus.subscribe(new LoggingAlertEventListener());
    }
}
