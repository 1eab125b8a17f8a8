package com.servicedesk.automation.controller;

import com.servicedesk.automation.model.IngestionResult;
import com.servicedesk.automation.model.RawMessage;
import com.servicedesk.automation.service.AutomationScheduler;
import com.servicedesk.automation.service.IngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/ingestion")
@Tag(name = "Ingestion", description = "Turn support emails into tickets")
public class IngestionController {

    private final IngestionService ingestionService;
    private final AutomationScheduler scheduler;
    private final Clock clock;

    public IngestionController(IngestionService ingestionService,
                               AutomationScheduler scheduler,
                               Clock clock) {
        this.ingestionService = ingestionService;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @PostMapping("/run")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = IngestionResult.class)))
    @Operation(summary = "Run an ingestion cycle",
               description = "Reads the configured source and creates tickets, exactly as the timer does. "
                       + "Already ingested messages are reported as duplicates.")
    public ResponseEntity<?> run() {
        IngestionResult result = scheduler.runIngestion();
        if (result == null) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "An ingestion cycle is already running"));
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping("/messages")
    @Operation(summary = "Submit one message",
               description = "Classifies and ingests a single email immediately")
    public ResponseEntity<IngestionResult> submit(@RequestBody RawMessage message) {
        IngestionResult result = ingestionService.submitMessage(message, clock.instant());
        HttpStatus status = result.getCreatedTicketIds().isEmpty() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(result);
    }
}
