package com.servicedesk.automation.model;

public enum TicketStatus {
    NEW,
    ASSIGNED,
    AUTO_RESOLVED,
    RESOLVED,
    ESCALATED;

    public boolean isTerminal() {
        return this == AUTO_RESOLVED || this == RESOLVED;
    }
}
