package com.servicedesk.automation.controller;

import com.servicedesk.automation.model.AutomationStatus;
import com.servicedesk.automation.service.AutomationScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/automation")
@Tag(name = "Automation", description = "Scheduled job status")
public class AutomationController {

    private final AutomationScheduler scheduler;

    public AutomationController(AutomationScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping("/status")
    @Operation(summary = "Automation status", description = "Whether timers are enabled and the last run of each job")
    public ResponseEntity<AutomationStatus> status() {
        return ResponseEntity.ok(scheduler.status());
    }
}
