package com.medimind.alert.core.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.medimind.alert.core.model.Alert;
import com.medimind.alert.core.model.AlertStatus;
import com.medimind.alert.core.rule.Severity;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AlertEventBusTest {
    private static final Instant NOW = Instant.parse("2025-01-01T08:00:00Z");

    private final AlertEventBus bus = new AlertEventBus();

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    void subscribersOnlyReceiveRequestedKinds() throws Exception {
        List<AlertEventType> seen = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(1);
        bus.subscribe(
                event -> {
                    seen.add(event.type());
                    latch.countDown();
                },
                AlertEventType.ALERT_RESOLVED);

        bus.publish(event(AlertEventType.ALERT));
        bus.publish(event(AlertEventType.ALERT_RESOLVED));

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen).containsExactly(AlertEventType.ALERT_RESOLVED);
    }

    @Test
    void publishDoesNotWaitForSlowSubscriber() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch fastDone = new CountDownLatch(3);
        bus.subscribe(event -> release.await());
        bus.subscribe(event -> fastDone.countDown());

        long started = System.nanoTime();
        for (int i = 0; i < 3; i++) {
            bus.publish(event(AlertEventType.ALERT));
        }
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(fastDone.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(elapsedMillis).isLessThan(1000);
        release.countDown();
    }

    @Test
    void failingSubscriberKeepsReceiving() throws Exception {
        CountDownLatch calls = new CountDownLatch(2);
        bus.subscribe(event -> {
            calls.countDown();
            throw new IllegalStateException("listener failure");
        });

        bus.publish(event(AlertEventType.ALERT));
        bus.publish(event(AlertEventType.ALERT_UPDATED));

        assertThat(calls.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void closedSubscriptionStopsDelivery() throws Exception {
        List<AlertEvent> seen = new CopyOnWriteArrayList<>();
        Subscription subscription = bus.subscribe(seen::add);

        subscription.close();
        bus.publish(event(AlertEventType.ALERT));
        Thread.sleep(50);

        assertThat(subscription.isActive()).isFalse();
        assertThat(bus.subscriberCount()).isZero();
        assertThat(seen).isEmpty();
    }

    @Test
    void closedBusRejectsSubscribers() {
        bus.close();

        assertThatThrownBy(() -> bus.subscribe(event -> {})).isInstanceOf(IllegalStateException.class);
    }

    private static AlertEvent event(AlertEventType type) {
        Alert alert = new Alert(
                "alert_1_x",
                "heart_rate_critical",
                "u1",
                Severity.CRITICAL,
                "Critical heart rate detected",
                Map.of("value", 35),
                NOW,
                NOW,
                AlertStatus.ACTIVE,
                false,
                null,
                true,
                Alert.NO_ESCALATION,
                null);
        return new AlertEvent(type, alert, NOW);
    }
}
