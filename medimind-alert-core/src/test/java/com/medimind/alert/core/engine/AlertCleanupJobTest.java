package com.medimind.alert.core.engine;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.medimind.alert.core.config.AlertingProperties;
import com.medimind.alert.core.store.ExpiryReport;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class AlertCleanupJobTest {

    private final AlertEngine engine = mock(AlertEngine.class);
    private final AlertingProperties properties = new AlertingProperties();
    private final AlertCleanupJob job = new AlertCleanupJob(engine, properties);

    @Test
    void sweepUsesConfiguredRetention() {
        properties.setRetentionHours(48);
        when(engine.cleanupExpiredAlerts(48)).thenReturn(new ExpiryReport(Instant.EPOCH, 0, 0, 0, List.of()));

        job.sweep();

        verify(engine).cleanupExpiredAlerts(48);
    }

    @Test
    void sweepSkipsWhenDisabled() {
        properties.getCleanup().setEnabled(false);

        job.sweep();

        verifyNoInteractions(engine);
    }
}
