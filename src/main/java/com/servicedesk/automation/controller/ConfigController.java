package com.servicedesk.automation.controller;

import com.servicedesk.automation.config.ClassificationConfig;
import com.servicedesk.automation.config.RoutingConfig;
import com.servicedesk.automation.config.SlaConfig;
import com.servicedesk.automation.model.ClassificationRule;
import com.servicedesk.automation.model.Priority;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "Read-only view of routing, SLA policy and classification rules")
public class ConfigController {

    private final RoutingConfig routingConfig;
    private final SlaConfig slaConfig;
    private final ClassificationConfig classificationConfig;

    public ConfigController(RoutingConfig routingConfig,
                            SlaConfig slaConfig,
                            ClassificationConfig classificationConfig) {
        this.routingConfig = routingConfig;
        this.slaConfig = slaConfig;
        this.classificationConfig = classificationConfig;
    }

    @Operation(summary = "Team mailbox per category")
    @GetMapping("/teams")
    public ResponseEntity<Map<String, Object>> getTeams() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("teams", routingConfig.getTeams());
        response.put("defaultTeam", routingConfig.getDefaultTeam());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "SLA windows per priority", description = "Windows in hours, plus the warning threshold")
    @GetMapping("/sla-policy")
    public ResponseEntity<Map<String, Object>> getSlaPolicy() {
        Map<String, Object> windows = new LinkedHashMap<>();
        for (Priority priority : Priority.values()) {
            SlaConfig.Window window = slaConfig.windowFor(priority);
            windows.put(priority.name(), Map.of(
                    "responseHours", window.getResponse().toMinutes() / 60.0,
                    "resolutionHours", window.getResolution().toMinutes() / 60.0));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("windows", windows);
        response.put("warningThresholdPct", slaConfig.getWarningThresholdPct());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Classification rules in evaluation order",
               description = "First match wins; no match falls back to OTHER / LOW")
    @GetMapping("/classification-rules")
    public ResponseEntity<List<ClassificationRule>> getClassificationRules() {
        return ResponseEntity.ok(classificationConfig.getRules());
    }
}
