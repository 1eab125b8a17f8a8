package com.servicedesk.automation.exception;

import lombok.Getter;

@Getter
public class TicketNotFoundException extends ServiceDeskException {

    private static final String ERROR_CODE = "TICKET_NOT_FOUND";

    private final long ticketId;

    public TicketNotFoundException(long ticketId) {
        super(String.format("Ticket %d not found", ticketId), ERROR_CODE);
        this.ticketId = ticketId;
    }
}
