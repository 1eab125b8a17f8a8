package com.servicedesk.automation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Something that happened to a ticket. Published after the state change it
 * describes has been stored; consumers must not assume delivery order across tickets.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketEvent {
    private TicketEventType type;
    private long ticketId;
    private Instant occurredAt;
    private Ticket ticket;          // snapshot after the change
}
