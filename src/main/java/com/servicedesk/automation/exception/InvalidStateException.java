package com.servicedesk.automation.exception;

import com.servicedesk.automation.model.TicketStatus;
import lombok.Getter;

/**
 * Requested transition is not allowed from the ticket's current status.
 */
@Getter
public class InvalidStateException extends ServiceDeskException {

    private static final String ERROR_CODE = "INVALID_STATE";

    private final long ticketId;
    private final TicketStatus currentStatus;
    private final TicketStatus requestedStatus;

    public InvalidStateException(long ticketId, TicketStatus currentStatus, TicketStatus requestedStatus) {
        this(String.format("Ticket %d cannot move from %s to %s", ticketId, currentStatus, requestedStatus),
                ERROR_CODE, ticketId, currentStatus, requestedStatus);
    }

    protected InvalidStateException(String message, String errorCode, long ticketId,
                                    TicketStatus currentStatus, TicketStatus requestedStatus) {
        super(message, errorCode);
        this.ticketId = ticketId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }
}
