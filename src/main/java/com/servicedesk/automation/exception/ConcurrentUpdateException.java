package com.servicedesk.automation.exception;

/**
 * Compare-and-swap update lost the race too many times in a row.
 */
public class ConcurrentUpdateException extends ServiceDeskException {

    private static final String ERROR_CODE = "CONCURRENT_UPDATE";

    public ConcurrentUpdateException(long ticketId, int attempts) {
        super(String.format("Ticket %d changed concurrently; gave up after %d attempts", ticketId, attempts),
                ERROR_CODE);
    }
}
