package com.servicedesk.automation.model;

public enum TicketEventType {
    TICKET_CREATED,
    TICKET_ASSIGNED,
    TICKET_AUTO_RESOLVED,
    TICKET_ESCALATED,
    TICKET_RESOLVED,
    RESPONSE_BREACH,
    RESOLUTION_BREACH,
    SLA_WARNING
}
