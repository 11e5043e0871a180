package com.medimind.controller.rest;

import com.medimind.alert.core.engine.AlertEngine;
import com.medimind.alert.core.error.AlertNotFoundException;
import com.medimind.alert.core.health.AlertHealthSummaryService;
import com.medimind.alert.core.health.AlertHealthSummaryService.AlertHealthSummary;
import com.medimind.alert.core.model.Alert;
import com.medimind.alert.core.model.VitalsSnapshot;
import com.medimind.alert.core.store.ExpiryReport;
import com.medimind.api.dto.AcknowledgeRequest;
import com.medimind.api.dto.ResolveRequest;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/alerts")
public class AlertController {
    private final AlertEngine engine;
    private final AlertHealthSummaryService healthSummary;

    public AlertController(AlertEngine engine, AlertHealthSummaryService healthSummary) {
        this.engine = engine;
        this.healthSummary = healthSummary;
    }

    @PostMapping("/vitals")
    public List<Alert> checkVitals(
            @RequestBody VitalsSnapshot snapshot, @RequestParam(required = false) String userId) {
        return engine.checkVitalSigns(snapshot, userId);
    }

    @PostMapping("/{alertId}/acknowledge")
    public Alert acknowledge(@PathVariable String alertId, @Valid @RequestBody AcknowledgeRequest body) {
        return engine.acknowledgeAlert(alertId, body.getUserId());
    }

    @PostMapping("/{alertId}/resolve")
    public Alert resolve(@PathVariable String alertId, @Valid @RequestBody ResolveRequest body) {
        return engine.resolveAlert(alertId, body.getUserId(), body.getResolution());
    }

    @GetMapping("/active")
    public List<Alert> active(@RequestParam(required = false) String userId) {
        return engine.getActiveAlerts(userId);
    }

    @GetMapping("/acknowledged")
    public List<Alert> acknowledged(@RequestParam(required = false) String userId) {
        return engine.getAcknowledgedAlerts(userId);
    }

    @GetMapping("/telemetry")
    public AlertHealthSummary telemetry() {
        return healthSummary.summary();
    }

    @GetMapping("/{alertId}")
    public Alert get(@PathVariable String alertId) {
        return engine.getAlert(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
    }

    @GetMapping("/{alertId}/escalation")
    public Map<String, Object> escalation(@PathVariable String alertId) {
        return Map.of("alertId", alertId, "state", engine.getEscalationState(alertId));
    }

    @PostMapping("/cleanup")
    public ExpiryReport cleanup(@RequestParam(defaultValue = "72") long hours) {
        return engine.cleanupExpiredAlerts(hours);
    }
}
