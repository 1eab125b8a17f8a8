package com.servicedesk.automation.controller;

import com.servicedesk.automation.model.SlaReport;
import com.servicedesk.automation.model.SlaSummary;
import com.servicedesk.automation.service.AutomationScheduler;
import com.servicedesk.automation.service.SlaMonitorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/sla")
@Tag(name = "SLA", description = "SLA sweeps and compliance summary")
public class SlaController {

    private final SlaMonitorService slaMonitorService;
    private final AutomationScheduler scheduler;
    private final Clock clock;

    public SlaController(SlaMonitorService slaMonitorService,
                         AutomationScheduler scheduler,
                         Clock clock) {
        this.slaMonitorService = slaMonitorService;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @PostMapping("/sweep")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = SlaReport.class)))
    @Operation(summary = "Run an SLA sweep",
               description = "Evaluates open tickets now, or at the given ISO-8601 instant. "
                       + "Without 'now' this is the same run the timer performs.")
    public ResponseEntity<?> sweep(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant now) {
        if (now != null) {
            return ResponseEntity.ok(slaMonitorService.sweep(now));
        }
        SlaReport report = scheduler.runSlaSweep();
        if (report == null) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "An SLA sweep is already running"));
        }
        return ResponseEntity.ok(report);
    }

    @GetMapping("/summary")
    @Operation(summary = "SLA compliance summary")
    public ResponseEntity<SlaSummary> summary() {
        return ResponseEntity.ok(slaMonitorService.summarize(clock.instant()));
    }
}
