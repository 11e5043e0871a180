package com.medimind.alert.core.store;

import java.time.Clock;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Builds ids of the form {@code alert_<epochMillis>_<random>}. */
@Component
@RequiredArgsConstructor
public class AlertIdFactory {
    private final Clock clock;

    public String next() {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return "alert_" + clock.millis() + "_" + random;
    }
}
