package com.servicedesk.automation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketHistoryEntry {
    private Instant at;
    private TicketStatus fromStatus;   // null for creation
    private TicketStatus toStatus;
    private String actor;              // "SYSTEM", "SLA_MONITOR" or the agent id
    private String detail;
}
