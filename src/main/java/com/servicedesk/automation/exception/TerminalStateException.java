package com.servicedesk.automation.exception;

import com.servicedesk.automation.model.TicketStatus;

/**
 * Mutation attempted on an AUTO_RESOLVED or RESOLVED ticket.
 */
public class TerminalStateException extends InvalidStateException {

    private static final String ERROR_CODE = "TERMINAL_STATE";

    public TerminalStateException(long ticketId, TicketStatus currentStatus, TicketStatus requestedStatus) {
        super(String.format("Ticket %d is already %s and cannot change", ticketId, currentStatus),
                ERROR_CODE, ticketId, currentStatus, requestedStatus);
    }
}
