package com.servicedesk.automation.controller;

import com.servicedesk.automation.model.Category;
import com.servicedesk.automation.model.PagedResponse;
import com.servicedesk.automation.model.Priority;
import com.servicedesk.automation.model.SlaState;
import com.servicedesk.automation.model.Ticket;
import com.servicedesk.automation.model.TicketDetail;
import com.servicedesk.automation.model.TicketStats;
import com.servicedesk.automation.model.TicketStatus;
import com.servicedesk.automation.service.TicketLifecycleService;
import com.servicedesk.automation.service.TicketQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/tickets")
@Tag(name = "Tickets", description = "Ticket lookup, search, aggregates and resolution")
public class TicketController {

    private final TicketQueryService queryService;
    private final TicketLifecycleService lifecycleService;
    private final Clock clock;

    public TicketController(TicketQueryService queryService,
                            TicketLifecycleService lifecycleService,
                            Clock clock) {
        this.queryService = queryService;
        this.lifecycleService = lifecycleService;
        this.clock = clock;
    }

    @GetMapping
    @Operation(summary = "List tickets",
               description = "Newest first. Filters combine with AND; q searches subject, body and sender. "
                       + "Pass nextCursor as 'before' to get the next page.")
    public ResponseEntity<PagedResponse<Ticket>> listTickets(
            @RequestParam(required = false) TicketStatus status,
            @RequestParam(required = false) Priority priority,
            @RequestParam(required = false) Category category,
            @RequestParam(required = false) SlaState slaState,
            @RequestParam(required = false) String q,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) Long before) {
        return ResponseEntity.ok(queryService.search(
                status, priority, category, slaState, q, limit, before, clock.instant()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get ticket detail", description = "Ticket with its current SLA standing")
    public ResponseEntity<TicketDetail> getTicket(@PathVariable long id) {
        return ResponseEntity.ok(queryService.detail(id, clock.instant()));
    }

    @PostMapping("/{id}/resolve")
    @Operation(summary = "Resolve a ticket",
               description = "Moves an ASSIGNED or ESCALATED ticket to RESOLVED. Body: {\"note\": ..., \"resolvedBy\": ...}")
    public ResponseEntity<?> resolveTicket(@PathVariable long id,
                                           @RequestBody Map<String, String> body) {
        String note = body.get("note");
        if (note == null || note.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "note is required"));
        }
        Ticket resolved = lifecycleService.resolve(id, note, body.get("resolvedBy"));
        return ResponseEntity.ok(resolved);
    }

    @GetMapping("/stats")
    @Operation(summary = "Ticket statistics", description = "Totals and distributions by status, priority and category")
    public ResponseEntity<TicketStats> getStats() {
        return ResponseEntity.ok(queryService.stats());
    }

    @GetMapping("/workload")
    @Operation(summary = "Team workload", description = "Open tickets per team mailbox")
    public ResponseEntity<Map<String, Integer>> getWorkload() {
        return ResponseEntity.ok(queryService.workload());
    }
}
